package ch.crossword.crosswordbackend.web.api.dto;

/**
 * Request body for host-only actions (start, close).
 *
 * @param userId caller identity, must match the game's host
 */
public record HostActionRequest(
        String userId
) {}
