package ch.crossword.crosswordbackend.domain.puzzle;

/**
 * Immutable 0-based grid position.
 *
 * <p>The string form {@code "row,col"} is the cell key used by the persisted fill map and by
 * the claim protocol.
 *
 * @param row 0-based row index
 * @param col 0-based column index
 */
public record CellCoord(int row, int col) {

    /**
     * Returns the cell key of this coordinate.
     *
     * @return key in the form {@code "row,col"}
     */
    public String key() {
        return row + "," + col;
    }

    /**
     * Parses a cell key of the form {@code "row,col"}.
     *
     * @param key cell key
     * @return parsed coordinate
     * @throws IllegalArgumentException if the key is malformed
     */
    public static CellCoord fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Cell key must not be null");
        }
        String[] parts = key.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid cell key: " + key);
        }
        try {
            return new CellCoord(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cell key: " + key, e);
        }
    }
}
