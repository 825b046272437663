package ch.crossword.crosswordbackend.domain.session;

import java.util.UUID;

/**
 * Fill state of a single cell. Exists only for cells that were filled successfully.
 *
 * @param letter the placed letter, always the cell's solution
 * @param correct always {@code true}; wrong guesses are never stored
 * @param ownerId player who claimed the cell, {@code null} in solo play
 */
public record CellState(String letter, boolean correct, UUID ownerId) {

    public static CellState claimed(String letter, UUID ownerId) {
        return new CellState(letter, true, ownerId);
    }
}
