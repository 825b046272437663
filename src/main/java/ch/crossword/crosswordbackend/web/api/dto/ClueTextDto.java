package ch.crossword.crosswordbackend.web.api.dto;

import ch.crossword.crosswordbackend.domain.enums.Direction;

public record ClueTextDto(
        Direction direction,
        int number,
        String text
) {}
