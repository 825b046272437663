package ch.crossword.crosswordbackend.web.api.dto;

import ch.crossword.crosswordbackend.domain.enums.GameStatus;

public record UpdateStatusRequest(
        GameStatus status
) {}
