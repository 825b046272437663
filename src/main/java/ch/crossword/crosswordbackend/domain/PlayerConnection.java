package ch.crossword.crosswordbackend.domain;

import ch.crossword.crosswordbackend.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * WebSocket presence of a player in a game.
 *
 * <p>Created when the player subscribes to the game's event topic with a {@code playerId}
 * header, flipped to disconnected when the STOMP session closes. A connection that stays
 * disconnected past the grace period leads to the player being removed from the game.
 */
@Entity
@Table(name = "player_connections",
        uniqueConstraints = @UniqueConstraint(columnNames = {"game_id", "player_id"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PlayerConnection extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_id", nullable = false)
    private Game game;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "player_id", nullable = false)
    private Player player;

    /**
     * STOMP session id of the latest subscription.
     */
    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "is_connected", nullable = false)
    private boolean connected;

    /**
     * Set while disconnected.
     */
    @Column(name = "disconnected_at")
    private Instant disconnectedAt;

    @Column(name = "reconnects", nullable = false)
    private int reconnects;

    public PlayerConnection(Game game, Player player, String sessionId) {
        this.game = game;
        this.player = player;
        this.sessionId = sessionId;
        this.connected = true;
    }

    public void markDisconnected() {
        this.connected = false;
        this.disconnectedAt = Instant.now();
    }

    public void markReconnected(String newSessionId) {
        if (!connected) {
            reconnects++;
        }
        this.connected = true;
        this.sessionId = newSessionId;
        this.disconnectedAt = null;
    }

    /**
     * Whether the connection is still down from the loss of the given session. {@code false} once
     * the player came back, even if a later session was lost again.
     */
    public boolean isStillDownFrom(String lostSessionId) {
        return !connected && Objects.equals(sessionId, lostSessionId);
    }
}
