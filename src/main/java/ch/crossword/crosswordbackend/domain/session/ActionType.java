package ch.crossword.crosswordbackend.domain.session;

/**
 * Discriminator of {@link PuzzleAction}. The reducer switches over it exhaustively, so adding a
 * constant without handling it fails compilation.
 */
public enum ActionType {
    LOAD_PUZZLE,
    RESET,
    SELECT_CELL,
    TOGGLE_DIRECTION,
    SET_DIRECTION,
    INPUT_LETTER,
    DELETE_LETTER,
    MOVE_SELECTION,
    NEXT_WORD,
    PREV_WORD,
    REMOTE_CELL_CLAIM,
    HYDRATE_CELLS,
    ROLLBACK_CELL
}
