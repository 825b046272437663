package ch.crossword.crosswordbackend.web.api.dto;

import ch.crossword.crosswordbackend.domain.FilledCell;

import java.util.UUID;

public record CellStateDto(
        String letter,
        boolean correct,
        UUID ownerId
) {

    public static CellStateDto from(FilledCell cell) {
        return new CellStateDto(cell.getLetter(), cell.isCorrect(), cell.getOwnerId());
    }
}
