package ch.crossword.crosswordbackend.domain.puzzle;

import ch.crossword.crosswordbackend.domain.enums.Direction;

/**
 * A numbered word slot.
 *
 * @param direction reading direction
 * @param number printed clue number
 * @param text clue prompt
 * @param row row of the first cell
 * @param col column of the first cell
 * @param length number of cells in the word
 * @param answer concatenated solutions of the word's cells
 */
public record Clue(
        Direction direction,
        int number,
        String text,
        int row,
        int col,
        int length,
        String answer
) {

    public CellCoord start() {
        return new CellCoord(row, col);
    }

    /**
     * Stable key of this clue, e.g. {@code "ACROSS-1"}.
     */
    public String key() {
        return direction.name() + "-" + number;
    }
}
