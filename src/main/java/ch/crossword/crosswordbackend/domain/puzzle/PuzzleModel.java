package ch.crossword.crosswordbackend.domain.puzzle;

import ch.crossword.crosswordbackend.domain.enums.Direction;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable representation of a loaded crossword: grid, clues and dimensions.
 *
 * <p>Created once when a puzzle is loaded and never mutated. The constructor validates the
 * structure and fails fast on malformed input:
 * <ul>
 *   <li>the grid is exactly {@code height x width} and every cell knows its own position</li>
 *   <li>solutions are single upper-case letters (or {@code null} for block cells)</li>
 *   <li>every clue starts a maximal run of at least two non-block cells in its direction,
 *       and its {@code length} and {@code answer} match that run</li>
 * </ul>
 *
 * @param title puzzle title
 * @param author puzzle author
 * @param width number of columns
 * @param height number of rows
 * @param cells grid, indexed {@code cells.get(row).get(col)}
 * @param clues all clues of both directions
 */
public record PuzzleModel(
        String title,
        String author,
        int width,
        int height,
        List<List<PuzzleCell>> cells,
        List<Clue> clues
) {

    public PuzzleModel {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Puzzle dimensions must be positive: " + width + "x" + height);
        }
        if (cells == null || cells.size() != height) {
            throw new IllegalArgumentException("Grid must have exactly " + height + " rows");
        }

        List<List<PuzzleCell>> rows = new ArrayList<>(height);
        for (int r = 0; r < height; r++) {
            List<PuzzleCell> row = cells.get(r);
            if (row == null || row.size() != width) {
                throw new IllegalArgumentException("Row " + r + " must have exactly " + width + " cells");
            }
            for (int c = 0; c < width; c++) {
                PuzzleCell cell = row.get(c);
                if (cell == null || cell.row() != r || cell.col() != c) {
                    throw new IllegalArgumentException("Cell at (" + r + "," + c + ") is missing or misplaced");
                }
                String solution = cell.solution();
                if (solution != null && (solution.length() != 1 || !Character.isUpperCase(solution.charAt(0)))) {
                    throw new IllegalArgumentException("Invalid solution at (" + r + "," + c + "): " + solution);
                }
            }
            rows.add(List.copyOf(row));
        }
        cells = List.copyOf(rows);
        clues = clues == null ? List.of() : List.copyOf(clues);

        for (Clue clue : clues) {
            validateClue(clue, cells, width, height);
        }
    }

    /**
     * Returns the cell at the given position.
     *
     * @throws IndexOutOfBoundsException if the position lies outside the grid
     */
    public PuzzleCell cellAt(int row, int col) {
        return cells.get(row).get(col);
    }

    public boolean inBounds(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    /**
     * Counts the fillable (non-block) cells, the denominator for completion.
     */
    public int fillableCellCount() {
        int count = 0;
        for (List<PuzzleCell> row : cells) {
            for (PuzzleCell cell : row) {
                if (!cell.isBlack()) count++;
            }
        }
        return count;
    }

    private static void validateClue(Clue clue, List<List<PuzzleCell>> cells, int width, int height) {
        if (clue == null || clue.direction() == null) {
            throw new IllegalArgumentException("Clue and its direction must not be null");
        }
        Direction dir = clue.direction();
        int r = clue.row();
        int c = clue.col();

        if (isBlackAt(cells, width, height, r, c)) {
            throw new IllegalArgumentException("Clue " + clue.key() + " starts on a block cell");
        }
        if (!isBlackAt(cells, width, height, r - dir.rowStep(), c - dir.colStep())) {
            throw new IllegalArgumentException("Clue " + clue.key() + " does not start a word");
        }

        StringBuilder answer = new StringBuilder();
        while (!isBlackAt(cells, width, height, r, c)) {
            answer.append(cells.get(r).get(c).solution());
            r += dir.rowStep();
            c += dir.colStep();
        }

        if (answer.length() < 2) {
            throw new IllegalArgumentException("Clue " + clue.key() + " covers a single cell");
        }
        if (clue.length() != answer.length() || !answer.toString().equals(clue.answer())) {
            throw new IllegalArgumentException(
                    "Clue " + clue.key() + " does not match the grid: expected " + answer + " but was " + clue.answer()
            );
        }
    }

    private static boolean isBlackAt(List<List<PuzzleCell>> cells, int width, int height, int r, int c) {
        if (r < 0 || r >= height || c < 0 || c >= width) return true;
        return cells.get(r).get(c).isBlack();
    }
}
