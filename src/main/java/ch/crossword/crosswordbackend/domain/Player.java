package ch.crossword.crosswordbackend.domain;

import ch.crossword.crosswordbackend.domain.common.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * A participant of one game.
 *
 * <p>{@code userId} is the caller's stable external identity and is used to recognise the same
 * person joining twice. The entity id is the player id referenced by claimed cells and events.
 */
@Entity
@Table(name = "players",
        uniqueConstraints = @UniqueConstraint(columnNames = {"game_id", "user_id"}))
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Player extends BaseEntity {

    /**
     * Owning game. The column is written through {@code Game.players}; mapped here read-only
     * for the one-player-per-user constraint.
     */
    @Setter(AccessLevel.NONE)
    @Column(name = "game_id", insertable = false, updatable = false)
    private UUID gameId;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "display_name", nullable = false, length = 50)
    private String displayName;

    /**
     * Hex color such as {@code #3b82f6}.
     */
    @Column(nullable = false, length = 7)
    private String color;

    /**
     * Number of cells this player claimed.
     */
    @Column(nullable = false)
    private int score;

    public Player(String userId, String displayName, String color) {
        this.userId = userId;
        this.displayName = displayName;
        this.color = color;
        this.score = 0;
    }

    public void incrementScore() {
        this.score++;
    }
}
