package ch.crossword.crosswordbackend.domain.session;

import ch.crossword.crosswordbackend.domain.enums.Direction;
import ch.crossword.crosswordbackend.domain.puzzle.CellCoord;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;

import java.util.Map;

/**
 * Immutable snapshot of one player's local view of a puzzle.
 *
 * <p>Only {@link PuzzleReducer} produces new snapshots. Invariants maintained by the reducer:
 * {@code score} equals the number of correct entries in {@code fillMap}, and
 * {@code selectedCell}, when set, addresses a non-block cell.
 *
 * @param puzzle loaded puzzle, {@code null} before the first load
 * @param fillMap filled cells
 * @param selectedCell cursor cell, {@code null} if nothing is selected
 * @param direction typing direction relative to the selected cell
 * @param score number of correctly filled cells
 * @param totalFillableCells number of non-block cells of the puzzle
 */
public record SessionState(
        PuzzleModel puzzle,
        Map<CellCoord, CellState> fillMap,
        CellCoord selectedCell,
        Direction direction,
        int score,
        int totalFillableCells
) {

    public SessionState {
        fillMap = fillMap == null ? Map.of() : Map.copyOf(fillMap);
        direction = direction == null ? Direction.ACROSS : direction;
    }

    /**
     * State before any puzzle is loaded.
     */
    public static SessionState initial() {
        return new SessionState(null, Map.of(), null, Direction.ACROSS, 0, 0);
    }

    public boolean isCorrect(CellCoord cell) {
        CellState state = fillMap.get(cell);
        return state != null && state.correct();
    }

    public boolean isComplete() {
        return totalFillableCells > 0 && score == totalFillableCells;
    }

    SessionState withCursor(CellCoord cell, Direction dir) {
        return new SessionState(puzzle, fillMap, cell, dir, score, totalFillableCells);
    }

    SessionState withFill(Map<CellCoord, CellState> cells, int newScore) {
        return new SessionState(puzzle, cells, selectedCell, direction, newScore, totalFillableCells);
    }
}
