package ch.crossword.crosswordbackend.domain.puzzle;

import ch.crossword.crosswordbackend.domain.enums.Direction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless navigation helpers over a {@link PuzzleModel}.
 *
 * <p>All coordinates are 0-based. Positions outside the grid count as block cells, so callers
 * never need a separate bounds check before asking {@link #isBlack(PuzzleModel, int, int)}.
 */
public final class GridTopology {

    private GridTopology() {
        // utility class
    }

    /**
     * @return {@code true} if the position is out of bounds or a block cell
     */
    public static boolean isBlack(PuzzleModel puzzle, int row, int col) {
        return !puzzle.inBounds(row, col) || puzzle.cellAt(row, col).isBlack();
    }

    /**
     * Returns all cells of the word running through {@code (row, col)} in the given direction.
     *
     * <p>Walks backwards to the first cell after a block (or the grid edge), then collects cells
     * forwards until the next block. A run of length one is returned as a single cell.
     *
     * @return cells of the word in reading order, empty if {@code (row, col)} is a block
     */
    public static List<CellCoord> wordCells(PuzzleModel puzzle, int row, int col, Direction direction) {
        if (isBlack(puzzle, row, col)) {
            return List.of();
        }

        int dr = direction.rowStep();
        int dc = direction.colStep();
        int r = row;
        int c = col;
        while (!isBlack(puzzle, r - dr, c - dc)) {
            r -= dr;
            c -= dc;
        }

        List<CellCoord> cells = new ArrayList<>();
        while (!isBlack(puzzle, r, c)) {
            cells.add(new CellCoord(r, c));
            r += dr;
            c += dc;
        }
        return cells;
    }

    /**
     * Finds the clue of the word running through {@code (row, col)}.
     *
     * @return the clue, or {@code null} for block cells, single-cell runs, and runs without a clue
     */
    public static Clue clueForCell(PuzzleModel puzzle, int row, int col, Direction direction) {
        List<CellCoord> word = wordCells(puzzle, row, col, direction);
        if (word.size() < 2) {
            return null;
        }
        CellCoord start = word.get(0);
        return puzzle.clues().stream()
                .filter(c -> c.direction() == direction)
                .filter(c -> c.row() == start.row() && c.col() == start.col())
                .findFirst()
                .orElse(null);
    }

    /**
     * Next non-block cell in the given direction, without wrapping to another word.
     *
     * @return the cell, or {@code null} at the edge of the grid or before a block
     */
    public static CellCoord nextCell(PuzzleModel puzzle, int row, int col, Direction direction) {
        int nr = row + direction.rowStep();
        int nc = col + direction.colStep();
        return isBlack(puzzle, nr, nc) ? null : new CellCoord(nr, nc);
    }

    /**
     * Previous non-block cell in the given direction, without wrapping to another word.
     *
     * @return the cell, or {@code null} at the edge of the grid or after a block
     */
    public static CellCoord prevCell(PuzzleModel puzzle, int row, int col, Direction direction) {
        int nr = row - direction.rowStep();
        int nc = col - direction.colStep();
        return isBlack(puzzle, nr, nc) ? null : new CellCoord(nr, nc);
    }

    /**
     * Clues of one direction ordered by number.
     */
    public static List<Clue> cluesOf(PuzzleModel puzzle, Direction direction) {
        return puzzle.clues().stream()
                .filter(c -> c.direction() == direction)
                .sorted(Comparator.comparingInt(Clue::number))
                .toList();
    }

    /**
     * Start of the word after the current one (Tab behaviour).
     *
     * <p>After the last clue of a direction the cursor wraps to the first clue of the other
     * direction, and the returned direction flips with it. If the other direction has no clues,
     * it wraps to the first clue of the same direction.
     *
     * @return the new cursor position; the given position if the puzzle has no clues at all
     */
    public static CursorPosition nextWordStart(PuzzleModel puzzle, int row, int col, Direction direction) {
        return wordStart(puzzle, row, col, direction, true);
    }

    /**
     * Start of the word before the current one (Shift+Tab behaviour). Mirror image of
     * {@link #nextWordStart(PuzzleModel, int, int, Direction)}, wrapping to the last clue.
     */
    public static CursorPosition prevWordStart(PuzzleModel puzzle, int row, int col, Direction direction) {
        return wordStart(puzzle, row, col, direction, false);
    }

    private static CursorPosition wordStart(PuzzleModel puzzle, int row, int col, Direction direction, boolean forward) {
        if (puzzle.clues().isEmpty()) {
            return new CursorPosition(new CellCoord(row, col), direction);
        }

        List<Clue> sameDirection = cluesOf(puzzle, direction);
        Clue current = clueForCell(puzzle, row, col, direction);

        if (current == null) {
            Clue fallback = sameDirection.isEmpty()
                    ? puzzle.clues().get(0)
                    : sameDirection.get(forward ? 0 : sameDirection.size() - 1);
            return startOf(fallback);
        }

        int idx = sameDirection.indexOf(current);
        int neighbour = forward ? idx + 1 : idx - 1;
        if (neighbour >= 0 && neighbour < sameDirection.size()) {
            return startOf(sameDirection.get(neighbour));
        }

        List<Clue> other = cluesOf(puzzle, direction.opposite());
        if (!other.isEmpty()) {
            return startOf(other.get(forward ? 0 : other.size() - 1));
        }
        return startOf(sameDirection.get(forward ? 0 : sameDirection.size() - 1));
    }

    private static CursorPosition startOf(Clue clue) {
        return new CursorPosition(clue.start(), clue.direction());
    }

    /**
     * Computes printed cell numbers.
     *
     * <p>Scans row-major; a cell gets the next number if it starts an across run or a down run
     * of at least two cells. One number serves both directions when both start at the same cell.
     *
     * @return numbers keyed by cell, in row-major order
     */
    public static Map<CellCoord, Integer> computeCellNumbers(PuzzleModel puzzle) {
        Map<CellCoord, Integer> numbers = new LinkedHashMap<>();
        int next = 1;

        for (int r = 0; r < puzzle.height(); r++) {
            for (int c = 0; c < puzzle.width(); c++) {
                if (isBlack(puzzle, r, c)) continue;

                if (startsRun(puzzle, r, c, Direction.ACROSS) || startsRun(puzzle, r, c, Direction.DOWN)) {
                    numbers.put(new CellCoord(r, c), next++);
                }
            }
        }
        return numbers;
    }

    /**
     * @return {@code true} if {@code (row, col)} is the first cell of a run of at least two cells
     */
    public static boolean startsRun(PuzzleModel puzzle, int row, int col, Direction direction) {
        int dr = direction.rowStep();
        int dc = direction.colStep();
        return !isBlack(puzzle, row, col)
                && isBlack(puzzle, row - dr, col - dc)
                && !isBlack(puzzle, row + dr, col + dc);
    }
}
