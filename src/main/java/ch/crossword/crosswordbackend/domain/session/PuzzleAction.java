package ch.crossword.crosswordbackend.domain.session;

import ch.crossword.crosswordbackend.domain.enums.Direction;
import ch.crossword.crosswordbackend.domain.puzzle.CellCoord;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;

import java.util.Map;
import java.util.UUID;

/**
 * Closed family of inputs to {@link PuzzleReducer}.
 */
public sealed interface PuzzleAction {

    ActionType type();

    record LoadPuzzle(PuzzleModel puzzle) implements PuzzleAction {
        public ActionType type() { return ActionType.LOAD_PUZZLE; }
    }

    record Reset() implements PuzzleAction {
        public ActionType type() { return ActionType.RESET; }
    }

    record SelectCell(int row, int col) implements PuzzleAction {
        public ActionType type() { return ActionType.SELECT_CELL; }
    }

    record ToggleDirection() implements PuzzleAction {
        public ActionType type() { return ActionType.TOGGLE_DIRECTION; }
    }

    record SetDirection(Direction direction) implements PuzzleAction {
        public ActionType type() { return ActionType.SET_DIRECTION; }
    }

    /**
     * @param letter typed letter, compared case-insensitively
     * @param ownerId player typing, {@code null} in solo play
     */
    record InputLetter(String letter, UUID ownerId) implements PuzzleAction {
        public ActionType type() { return ActionType.INPUT_LETTER; }
    }

    record DeleteLetter() implements PuzzleAction {
        public ActionType type() { return ActionType.DELETE_LETTER; }
    }

    record MoveSelection(int dRow, int dCol) implements PuzzleAction {
        public ActionType type() { return ActionType.MOVE_SELECTION; }
    }

    record NextWord() implements PuzzleAction {
        public ActionType type() { return ActionType.NEXT_WORD; }
    }

    record PrevWord() implements PuzzleAction {
        public ActionType type() { return ActionType.PREV_WORD; }
    }

    /**
     * Another player's claim, confirmed by the server.
     */
    record RemoteCellClaim(int row, int col, String letter, UUID ownerId) implements PuzzleAction {
        public ActionType type() { return ActionType.REMOTE_CELL_CLAIM; }
    }

    /**
     * Trusted server state replacing the local fill map wholesale.
     */
    record HydrateCells(Map<CellCoord, CellState> cells, int score) implements PuzzleAction {
        public ActionType type() { return ActionType.HYDRATE_CELLS; }
    }

    record RollbackCell(int row, int col, UUID ownerId) implements PuzzleAction {
        public ActionType type() { return ActionType.ROLLBACK_CELL; }
    }

    static PuzzleAction loadPuzzle(PuzzleModel puzzle) {
        return new LoadPuzzle(puzzle);
    }

    static PuzzleAction selectCell(int row, int col) {
        return new SelectCell(row, col);
    }

    static PuzzleAction inputLetter(String letter) {
        return new InputLetter(letter, null);
    }

    static PuzzleAction inputLetter(String letter, UUID ownerId) {
        return new InputLetter(letter, ownerId);
    }

    static PuzzleAction deleteLetter() {
        return new DeleteLetter();
    }

    static PuzzleAction moveSelection(int dRow, int dCol) {
        return new MoveSelection(dRow, dCol);
    }
}
