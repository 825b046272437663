package ch.crossword.crosswordbackend.testutil;

import ch.crossword.crosswordbackend.domain.Puzzle;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleFactory;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;

import java.util.List;

/**
 * Shared 3x3 grid:
 * <pre>
 * C A T
 * A # O
 * B E T
 * </pre>
 * Across: 1 CAT, 3 BET. Down: 1 CAB, 2 TOT. Eight fillable cells.
 */
public final class TestPuzzles {

    public static final List<String> CAT_ROWS = List.of("CAT", "A#O", "BET");

    private TestPuzzles() {
        // utility class
    }

    public static PuzzleModel catModel() {
        return PuzzleFactory.fromRows(CAT_ROWS);
    }

    public static Puzzle catEntity() {
        return new Puzzle("Cats", "Tester", CAT_ROWS, List.of(), "cat-hash");
    }
}
