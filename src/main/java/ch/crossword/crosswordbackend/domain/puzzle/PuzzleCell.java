package ch.crossword.crosswordbackend.domain.puzzle;

/**
 * One cell of a puzzle grid.
 *
 * @param row 0-based row
 * @param col 0-based column
 * @param solution single upper-case letter, or {@code null} for a block (BLACK) cell
 * @param number clue number printed in the cell, or {@code null}
 */
public record PuzzleCell(int row, int col, String solution, Integer number) {

    public boolean isBlack() {
        return solution == null;
    }

    public CellCoord coord() {
        return new CellCoord(row, col);
    }
}
