package ch.crossword.crosswordbackend.domain.enums;

/**
 * Reading direction of a word slot in the grid.
 */
public enum Direction {
    ACROSS,
    DOWN;

    /**
     * Returns the other direction.
     *
     * @return {@code DOWN} for {@code ACROSS} and vice versa
     */
    public Direction opposite() {
        return this == ACROSS ? DOWN : ACROSS;
    }

    /**
     * Row step when moving one cell forward in this direction.
     */
    public int rowStep() {
        return this == DOWN ? 1 : 0;
    }

    /**
     * Column step when moving one cell forward in this direction.
     */
    public int colStep() {
        return this == ACROSS ? 1 : 0;
    }
}
