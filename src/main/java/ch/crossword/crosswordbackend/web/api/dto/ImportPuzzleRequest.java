package ch.crossword.crosswordbackend.web.api.dto;

import java.util.List;

/**
 * Puzzle upload.
 *
 * @param title puzzle title
 * @param author puzzle author, optional
 * @param rows grid rows, one character per cell: a letter or {@code #} for a block
 * @param clues clue prompts by direction and printed number
 */
public record ImportPuzzleRequest(
        String title,
        String author,
        List<String> rows,
        List<ClueTextDto> clues
) {}
