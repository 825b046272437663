package ch.crossword.crosswordbackend.domain.puzzle;

import ch.crossword.crosswordbackend.domain.enums.Direction;

/**
 * A selected cell together with the direction the player is typing in.
 */
public record CursorPosition(CellCoord cell, Direction direction) {
}
