package ch.crossword.crosswordbackend.domain;

import ch.crossword.crosswordbackend.domain.common.BaseEntity;
import ch.crossword.crosswordbackend.domain.enums.GameStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A crossword game: one puzzle, its players and the authoritative fill state.
 *
 * <p>Every client holds a replica of {@link #cells}; only the claim arbiter writes to it. Rule
 * checks such as "game must be active" live in the service layer, this entity only offers the
 * state changes.
 */
@Entity
@Table(name = "games")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Game extends BaseEntity {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GameStatus status;

    /**
     * Room code shared with other players. Released (set to {@code null}) when the room moves
     * on to a follow-up game.
     */
    @Column(name = "short_code", unique = true, length = 6)
    private String shortCode;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "puzzle_id", nullable = false)
    private Puzzle puzzle;

    /**
     * Caller identity of whoever created the game. Host actions (start, close, next game) are
     * checked against it, which also covers spectator hosts without a player record.
     */
    @Column(name = "host_user_id", nullable = false, length = 100)
    private String hostUserId;

    @Embedded
    private GameSettings settings;

    /**
     * Number of non-block cells, the completion threshold.
     */
    @Column(name = "fillable_cells", nullable = false)
    private int fillableCells;

    @Column(name = "completed_at")
    private Instant completedAt;

    /**
     * Players in join order. The first one is the host.
     */
    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @JoinColumn(name = "game_id")
    @OrderColumn(name = "join_index")
    private List<Player> players = new ArrayList<>();

    /**
     * Claimed cells keyed by {@code "row,col"}.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "game_cells", joinColumns = @JoinColumn(name = "game_id"))
    @MapKeyColumn(name = "cell_key", length = 16)
    private Map<String, FilledCell> cells = new HashMap<>();

    @ElementCollection
    @CollectionTable(name = "game_clue_credits", joinColumns = @JoinColumn(name = "game_id"))
    @OrderColumn(name = "credit_index")
    private List<ClueCredit> clueCredits = new ArrayList<>();

    public Game(Puzzle puzzle, GameStatus status, String shortCode, String hostUserId,
                GameSettings settings, int fillableCells) {
        this.puzzle = puzzle;
        this.status = status;
        this.shortCode = shortCode;
        this.hostUserId = hostUserId;
        this.settings = settings;
        this.fillableCells = fillableCells;
    }

    public void addPlayer(Player player) {
        this.players.add(player);
    }

    public boolean removePlayer(Player player) {
        return this.players.remove(player);
    }

    public Optional<Player> findPlayer(UUID playerId) {
        return players.stream()
                .filter(p -> p != null && p.getId() != null)
                .filter(p -> p.getId().equals(playerId))
                .findFirst();
    }

    public Optional<Player> findPlayerByUserId(String userId) {
        return players.stream()
                .filter(p -> p != null && userId.equals(p.getUserId()))
                .findFirst();
    }

    public boolean isHost(String userId) {
        return userId != null && userId.equals(hostUserId);
    }

    public boolean isCellClaimed(String cellKey) {
        FilledCell cell = cells.get(cellKey);
        return cell != null && cell.isCorrect();
    }

    /**
     * Writes a correct letter into the cell. Callers must check {@link #isCellClaimed(String)} first.
     */
    public void claimCell(String cellKey, String letter, UUID playerId) {
        cells.put(cellKey, new FilledCell(letter, true, playerId));
    }

    public long correctCellCount() {
        return cells.values().stream().filter(FilledCell::isCorrect).count();
    }

    /**
     * @return {@code true} once every fillable cell holds a correct letter
     */
    public boolean isFilled() {
        return fillableCells > 0 && correctCellCount() >= fillableCells;
    }

    public void addClueCredit(ClueCredit credit) {
        this.clueCredits.add(credit);
    }

    /**
     * Moves the game to {@code next}.
     *
     * @return {@code false} if the game already is in {@code next} (no change)
     * @throws IllegalStateException if the transition is not allowed
     */
    public boolean transitionTo(GameStatus next) {
        if (status == next) {
            return false;
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Cannot move game from " + status + " to " + next);
        }
        this.status = next;
        if (next == GameStatus.COMPLETED) {
            this.completedAt = Instant.now();
        }
        return true;
    }
}
