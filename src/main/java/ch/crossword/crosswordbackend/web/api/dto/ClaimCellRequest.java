package ch.crossword.crosswordbackend.web.api.dto;

import java.util.UUID;

/**
 * Request to claim one cell.
 *
 * @param cellKey cell in the form {@code "row,col"}
 * @param letter letter to place
 * @param playerId claiming player
 * @param correct the client's own correctness check against the puzzle solution
 */
public record ClaimCellRequest(
        String cellKey,
        String letter,
        UUID playerId,
        boolean correct
) {}
