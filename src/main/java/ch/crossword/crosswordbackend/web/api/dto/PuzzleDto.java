package ch.crossword.crosswordbackend.web.api.dto;

import java.util.List;
import java.util.UUID;

/**
 * A stored puzzle as delivered to clients. Rows contain the solutions, which clients need for
 * their local correctness check.
 */
public record PuzzleDto(
        UUID id,
        String title,
        String author,
        int width,
        int height,
        List<String> rows,
        List<ClueDto> clues
) {}
