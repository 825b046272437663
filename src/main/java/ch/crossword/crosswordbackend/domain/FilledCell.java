package ch.crossword.crosswordbackend.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Authoritative fill state of one claimed cell of a game.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FilledCell {

    @Column(name = "letter", nullable = false, length = 1)
    private String letter;

    @Column(name = "correct", nullable = false)
    private boolean correct;

    /**
     * Player who claimed the cell.
     */
    @Column(name = "owner_id")
    private UUID ownerId;

    public FilledCell(String letter, boolean correct, UUID ownerId) {
        this.letter = letter;
        this.correct = correct;
        this.ownerId = ownerId;
    }
}
