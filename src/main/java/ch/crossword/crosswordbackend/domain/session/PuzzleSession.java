package ch.crossword.crosswordbackend.domain.session;

import ch.crossword.crosswordbackend.domain.enums.Direction;
import ch.crossword.crosswordbackend.domain.puzzle.CellCoord;
import ch.crossword.crosswordbackend.domain.puzzle.Clue;
import ch.crossword.crosswordbackend.domain.puzzle.GridTopology;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Holder of the current {@link SessionState} of one client.
 *
 * <p>All changes go through {@link #dispatch(PuzzleAction)}, which runs the reducer and swaps the
 * snapshot. Dispatch is serialized, so input handlers and network callbacks may call it from
 * different threads.
 */
public class PuzzleSession {

    private volatile SessionState state = SessionState.initial();

    public synchronized SessionState dispatch(PuzzleAction action) {
        state = PuzzleReducer.reduce(state, action);
        return state;
    }

    public SessionState getState() {
        return state;
    }

    /**
     * Cells of the word under the cursor, empty if nothing is selected.
     */
    public Set<CellCoord> highlightedCells() {
        SessionState current = state;
        if (current.puzzle() == null || current.selectedCell() == null) {
            return Set.of();
        }
        CellCoord sel = current.selectedCell();
        return new LinkedHashSet<>(GridTopology.wordCells(current.puzzle(), sel.row(), sel.col(), current.direction()));
    }

    /**
     * Clue of the word under the cursor, {@code null} if none.
     */
    public Clue activeClue() {
        SessionState current = state;
        if (current.puzzle() == null || current.selectedCell() == null) {
            return null;
        }
        CellCoord sel = current.selectedCell();
        return GridTopology.clueForCell(current.puzzle(), sel.row(), sel.col(), current.direction());
    }

    public boolean isComplete() {
        return state.isComplete();
    }

    // convenience dispatchers

    public SessionState loadPuzzle(PuzzleModel puzzle) {
        return dispatch(new PuzzleAction.LoadPuzzle(puzzle));
    }

    public SessionState reset() {
        return dispatch(new PuzzleAction.Reset());
    }

    public SessionState selectCell(int row, int col) {
        return dispatch(new PuzzleAction.SelectCell(row, col));
    }

    public SessionState toggleDirection() {
        return dispatch(new PuzzleAction.ToggleDirection());
    }

    public SessionState setDirection(Direction direction) {
        return dispatch(new PuzzleAction.SetDirection(direction));
    }

    public SessionState inputLetter(String letter, UUID ownerId) {
        return dispatch(new PuzzleAction.InputLetter(letter, ownerId));
    }

    public SessionState deleteLetter() {
        return dispatch(new PuzzleAction.DeleteLetter());
    }

    public SessionState moveSelection(int dRow, int dCol) {
        return dispatch(new PuzzleAction.MoveSelection(dRow, dCol));
    }

    public SessionState nextWord() {
        return dispatch(new PuzzleAction.NextWord());
    }

    public SessionState prevWord() {
        return dispatch(new PuzzleAction.PrevWord());
    }
}
