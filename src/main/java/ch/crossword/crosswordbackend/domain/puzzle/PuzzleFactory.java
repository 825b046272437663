package ch.crossword.crosswordbackend.domain.puzzle;

import ch.crossword.crosswordbackend.domain.enums.Direction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link PuzzleModel} from text grid rows.
 *
 * <p>Row format: one character per cell, a letter for a fillable cell and {@code '#'} or
 * {@code '.'} for a block. Cell numbers are computed from the grid; each clue is given by
 * direction, number and prompt, and its position, length and answer are derived from the grid.
 */
public final class PuzzleFactory {

    /**
     * Clue prompt keyed by direction and printed number.
     */
    public record ClueText(Direction direction, int number, String text) {
    }

    private PuzzleFactory() {
        // utility class
    }

    /**
     * Builds a puzzle with the given clue prompts.
     *
     * @throws IllegalArgumentException if the grid is not rectangular, contains invalid characters,
     *                                  or a clue number does not start a word in its direction
     */
    public static PuzzleModel fromRows(String title, String author, List<String> rows, List<ClueText> clueTexts) {
        PuzzleModel grid = gridOnly(title, author, rows);
        Map<CellCoord, Integer> numbers = GridTopology.computeCellNumbers(grid);

        List<Clue> clues = new ArrayList<>();
        for (ClueText text : clueTexts) {
            if (text == null || text.direction() == null) {
                throw new IllegalArgumentException("Clue and its direction must not be null");
            }
            CellCoord start = numbers.entrySet().stream()
                    .filter(e -> e.getValue() == text.number())
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("No cell is numbered " + text.number()));

            if (!GridTopology.startsRun(grid, start.row(), start.col(), text.direction())) {
                throw new IllegalArgumentException(
                        "Number " + text.number() + " does not start an " + text.direction() + " word");
            }
            clues.add(clueAt(grid, start, text.direction(), text.number(), text.text()));
        }

        return new PuzzleModel(title, author, grid.width(), grid.height(), numbered(grid, numbers), clues);
    }

    /**
     * Builds a puzzle with a generated clue for every word of at least two cells.
     * The prompt of each generated clue is its key, e.g. {@code "ACROSS-1"}.
     */
    public static PuzzleModel fromRows(List<String> rows) {
        PuzzleModel grid = gridOnly("Untitled", "", rows);
        Map<CellCoord, Integer> numbers = GridTopology.computeCellNumbers(grid);

        List<Clue> clues = new ArrayList<>();
        for (Direction direction : Direction.values()) {
            for (Map.Entry<CellCoord, Integer> entry : numbers.entrySet()) {
                CellCoord start = entry.getKey();
                if (GridTopology.startsRun(grid, start.row(), start.col(), direction)) {
                    clues.add(clueAt(grid, start, direction, entry.getValue(), direction.name() + "-" + entry.getValue()));
                }
            }
        }
        return new PuzzleModel(grid.title(), grid.author(), grid.width(), grid.height(), numbered(grid, numbers), clues);
    }

    private static PuzzleModel gridOnly(String title, String author, List<String> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("Grid must contain at least one row");
        }
        int width = rows.get(0).length();
        List<List<PuzzleCell>> cells = new ArrayList<>();

        for (int r = 0; r < rows.size(); r++) {
            String line = rows.get(r);
            if (line == null || line.length() != width) {
                throw new IllegalArgumentException("Grid row " + r + " must have " + width + " characters");
            }
            List<PuzzleCell> row = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                char ch = line.charAt(c);
                if (ch == '#' || ch == '.') {
                    row.add(new PuzzleCell(r, c, null, null));
                } else if (Character.isLetter(ch)) {
                    row.add(new PuzzleCell(r, c, String.valueOf(Character.toUpperCase(ch)), null));
                } else {
                    throw new IllegalArgumentException("Invalid grid character '" + ch + "' at (" + r + "," + c + ")");
                }
            }
            cells.add(row);
        }
        return new PuzzleModel(title, author, width, rows.size(), cells, List.of());
    }

    private static Clue clueAt(PuzzleModel grid, CellCoord start, Direction direction, int number, String text) {
        StringBuilder answer = new StringBuilder();
        for (CellCoord c : GridTopology.wordCells(grid, start.row(), start.col(), direction)) {
            answer.append(grid.cellAt(c.row(), c.col()).solution());
        }
        return new Clue(direction, number, text, start.row(), start.col(), answer.length(), answer.toString());
    }

    private static List<List<PuzzleCell>> numbered(PuzzleModel grid, Map<CellCoord, Integer> numbers) {
        List<List<PuzzleCell>> cells = new ArrayList<>();
        for (List<PuzzleCell> row : grid.cells()) {
            List<PuzzleCell> copy = new ArrayList<>(row.size());
            for (PuzzleCell cell : row) {
                copy.add(new PuzzleCell(cell.row(), cell.col(), cell.solution(), numbers.get(cell.coord())));
            }
            cells.add(copy);
        }
        return cells;
    }
}
