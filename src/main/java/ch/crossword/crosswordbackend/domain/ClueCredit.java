package ch.crossword.crosswordbackend.domain;

import ch.crossword.crosswordbackend.domain.enums.Direction;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Records which player completed a word: the one whose granted claim made every cell of the
 * word correct.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ClueCredit {

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 10)
    private Direction direction;

    @Column(name = "clue_number", nullable = false)
    private int clueNumber;

    @Column(name = "player_id", nullable = false)
    private UUID playerId;

    public ClueCredit(Direction direction, int clueNumber, UUID playerId) {
        this.direction = direction;
        this.clueNumber = clueNumber;
        this.playerId = playerId;
    }
}
