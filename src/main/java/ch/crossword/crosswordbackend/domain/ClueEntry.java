package ch.crossword.crosswordbackend.domain;

import ch.crossword.crosswordbackend.domain.enums.Direction;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Stored clue prompt of a puzzle. Length and answer are not stored; they are derived from the
 * grid whenever the puzzle is loaded.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ClueEntry {

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 10)
    private Direction direction;

    @Column(name = "clue_number", nullable = false)
    private int number;

    @Column(name = "clue_text", nullable = false, length = 500)
    private String text;

    public ClueEntry(Direction direction, int number, String text) {
        this.direction = direction;
        this.number = number;
        this.text = text;
    }
}
