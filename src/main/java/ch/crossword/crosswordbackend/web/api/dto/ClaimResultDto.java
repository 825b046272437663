package ch.crossword.crosswordbackend.web.api.dto;

import ch.crossword.crosswordbackend.domain.enums.ClaimOutcome;

public record ClaimResultDto(
        ClaimOutcome outcome
) {}
