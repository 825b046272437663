package ch.crossword.crosswordbackend.domain.session;

import ch.crossword.crosswordbackend.domain.enums.Direction;
import ch.crossword.crosswordbackend.domain.puzzle.CellCoord;
import ch.crossword.crosswordbackend.domain.puzzle.Clue;
import ch.crossword.crosswordbackend.domain.puzzle.CursorPosition;
import ch.crossword.crosswordbackend.domain.puzzle.GridTopology;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleCell;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Pure state transition function for a puzzle session.
 *
 * <p>{@link #reduce(SessionState, PuzzleAction)} never performs I/O, never reads a clock and never
 * mutates its input. Replaying the same actions on the same initial state always yields an equal
 * state, which is what allows clients to apply their own input optimistically before the server
 * confirms it.
 *
 * <p>Wrong letters are not errors: {@code INPUT_LETTER} with a mismatching letter returns the
 * given state unchanged.
 */
public final class PuzzleReducer {

    private PuzzleReducer() {
        // utility class
    }

    public static SessionState reduce(SessionState state, PuzzleAction action) {
        return switch (action.type()) {
            case LOAD_PUZZLE -> loadPuzzle(((PuzzleAction.LoadPuzzle) action).puzzle());
            case RESET -> SessionState.initial();
            case SELECT_CELL -> selectCell(state, (PuzzleAction.SelectCell) action);
            case TOGGLE_DIRECTION -> state.withCursor(state.selectedCell(), state.direction().opposite());
            case SET_DIRECTION -> state.withCursor(state.selectedCell(), ((PuzzleAction.SetDirection) action).direction());
            case INPUT_LETTER -> inputLetter(state, (PuzzleAction.InputLetter) action);
            case DELETE_LETTER -> deleteLetter(state);
            case MOVE_SELECTION -> moveSelection(state, (PuzzleAction.MoveSelection) action);
            case NEXT_WORD -> jumpWord(state, true);
            case PREV_WORD -> jumpWord(state, false);
            case REMOTE_CELL_CLAIM -> remoteClaim(state, (PuzzleAction.RemoteCellClaim) action);
            case HYDRATE_CELLS -> {
                PuzzleAction.HydrateCells hydrate = (PuzzleAction.HydrateCells) action;
                yield state.withFill(hydrate.cells(), hydrate.score());
            }
            case ROLLBACK_CELL -> rollback(state, (PuzzleAction.RollbackCell) action);
        };
    }

    // ------------------------------------------------------------------
    // Actions
    // ------------------------------------------------------------------

    private static SessionState loadPuzzle(PuzzleModel puzzle) {
        CellCoord first = null;
        for (int r = 0; r < puzzle.height() && first == null; r++) {
            for (int c = 0; c < puzzle.width() && first == null; c++) {
                if (!GridTopology.isBlack(puzzle, r, c)) {
                    first = new CellCoord(r, c);
                }
            }
        }
        return new SessionState(puzzle, Map.of(), first, Direction.ACROSS, 0, puzzle.fillableCellCount());
    }

    private static SessionState selectCell(SessionState state, PuzzleAction.SelectCell action) {
        PuzzleModel puzzle = state.puzzle();
        if (puzzle == null || GridTopology.isBlack(puzzle, action.row(), action.col())) {
            return state;
        }
        CellCoord target = new CellCoord(action.row(), action.col());
        if (target.equals(state.selectedCell())) {
            return state.withCursor(target, state.direction().opposite());
        }
        return state.withCursor(target, state.direction());
    }

    private static SessionState inputLetter(SessionState state, PuzzleAction.InputLetter action) {
        PuzzleModel puzzle = state.puzzle();
        CellCoord selected = state.selectedCell();
        if (puzzle == null || selected == null || action.letter() == null) {
            return state;
        }
        PuzzleCell cell = puzzle.cellAt(selected.row(), selected.col());
        if (cell.isBlack()) {
            return state;
        }

        if (state.isCorrect(selected)) {
            CursorPosition next = advanceCursor(puzzle, state.fillMap(), selected, state.direction());
            return next == null ? state : state.withCursor(next.cell(), next.direction());
        }

        String letter = action.letter().toUpperCase(Locale.ROOT);
        if (!letter.equals(cell.solution())) {
            return state;
        }

        Map<CellCoord, CellState> cells = new HashMap<>(state.fillMap());
        cells.put(selected, CellState.claimed(letter, action.ownerId()));
        SessionState filled = state.withFill(cells, state.score() + 1);

        CursorPosition next = advanceCursor(puzzle, filled.fillMap(), selected, state.direction());
        return next == null ? filled : filled.withCursor(next.cell(), next.direction());
    }

    private static SessionState deleteLetter(SessionState state) {
        PuzzleModel puzzle = state.puzzle();
        CellCoord selected = state.selectedCell();
        if (puzzle == null || selected == null) {
            return state;
        }

        if (state.fillMap().containsKey(selected)) {
            return state.withFill(without(state.fillMap(), selected), state.score() - 1);
        }

        CellCoord prev = GridTopology.prevCell(puzzle, selected.row(), selected.col(), state.direction());
        if (prev == null) {
            return state;
        }
        if (state.fillMap().containsKey(prev)) {
            return state.withFill(without(state.fillMap(), prev), state.score() - 1)
                    .withCursor(prev, state.direction());
        }
        return state.withCursor(prev, state.direction());
    }

    private static SessionState moveSelection(SessionState state, PuzzleAction.MoveSelection action) {
        PuzzleModel puzzle = state.puzzle();
        CellCoord selected = state.selectedCell();
        if (puzzle == null || selected == null) {
            return state;
        }
        int nr = selected.row() + action.dRow();
        int nc = selected.col() + action.dCol();
        if (GridTopology.isBlack(puzzle, nr, nc)) {
            return state;
        }

        Direction dir = state.direction();
        if (action.dRow() != 0) {
            dir = Direction.DOWN;
        } else if (action.dCol() != 0) {
            dir = Direction.ACROSS;
        }
        return state.withCursor(new CellCoord(nr, nc), dir);
    }

    private static SessionState jumpWord(SessionState state, boolean forward) {
        PuzzleModel puzzle = state.puzzle();
        CellCoord selected = state.selectedCell();
        if (puzzle == null || selected == null) {
            return state;
        }
        CursorPosition target = forward
                ? GridTopology.nextWordStart(puzzle, selected.row(), selected.col(), state.direction())
                : GridTopology.prevWordStart(puzzle, selected.row(), selected.col(), state.direction());
        return state.withCursor(target.cell(), target.direction());
    }

    private static SessionState remoteClaim(SessionState state, PuzzleAction.RemoteCellClaim action) {
        PuzzleModel puzzle = state.puzzle();
        if (puzzle == null || GridTopology.isBlack(puzzle, action.row(), action.col())) {
            return state;
        }
        CellCoord target = new CellCoord(action.row(), action.col());
        if (state.isCorrect(target)) {
            return state;
        }
        Map<CellCoord, CellState> cells = new HashMap<>(state.fillMap());
        cells.put(target, CellState.claimed(action.letter(), action.ownerId()));
        return state.withFill(cells, state.score() + 1);
    }

    private static SessionState rollback(SessionState state, PuzzleAction.RollbackCell action) {
        CellCoord target = new CellCoord(action.row(), action.col());
        CellState existing = state.fillMap().get(target);
        if (existing == null || !Objects.equals(existing.ownerId(), action.ownerId())) {
            return state;
        }
        return state.withFill(without(state.fillMap(), target), state.score() - 1);
    }

    // ------------------------------------------------------------------
    // Cursor advance
    // ------------------------------------------------------------------

    /**
     * Finds where the cursor goes after a letter was placed (or skipped) at {@code from}.
     *
     * <p>First the rest of the current word is searched for an empty cell. If the word is full,
     * clues are scanned as a ring ordered current direction first, each group by number, starting
     * right after the current clue.
     *
     * @return the new position, or {@code null} if every clue is filled
     */
    static CursorPosition advanceCursor(PuzzleModel puzzle, Map<CellCoord, CellState> fill,
                                        CellCoord from, Direction direction) {
        List<CellCoord> word = GridTopology.wordCells(puzzle, from.row(), from.col(), direction);
        int idx = word.indexOf(from);
        for (int i = idx + 1; i < word.size(); i++) {
            CellCoord candidate = word.get(i);
            if (!isCorrect(fill, candidate)) {
                return new CursorPosition(candidate, direction);
            }
        }

        List<Clue> ring = new ArrayList<>(puzzle.clues());
        if (ring.isEmpty()) {
            return null;
        }
        ring.sort(Comparator
                .comparing((Clue c) -> c.direction() == direction ? 0 : 1)
                .thenComparingInt(Clue::number));

        Clue current = GridTopology.clueForCell(puzzle, from.row(), from.col(), direction);
        int startIdx = current == null ? -1 : ring.indexOf(current);

        for (int offset = 1; offset <= ring.size(); offset++) {
            Clue clue = ring.get(Math.floorMod(startIdx + offset, ring.size()));
            for (CellCoord cell : GridTopology.wordCells(puzzle, clue.row(), clue.col(), clue.direction())) {
                if (!isCorrect(fill, cell)) {
                    return new CursorPosition(cell, clue.direction());
                }
            }
        }
        return null;
    }

    private static boolean isCorrect(Map<CellCoord, CellState> fill, CellCoord cell) {
        CellState state = fill.get(cell);
        return state != null && state.correct();
    }

    private static Map<CellCoord, CellState> without(Map<CellCoord, CellState> fill, CellCoord cell) {
        Map<CellCoord, CellState> copy = new HashMap<>(fill);
        copy.remove(cell);
        return copy;
    }
}
