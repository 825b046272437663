package ch.crossword.crosswordbackend.web.api.dto;

import ch.crossword.crosswordbackend.domain.enums.Direction;
import ch.crossword.crosswordbackend.domain.puzzle.Clue;

public record ClueDto(
        Direction direction,
        int number,
        String text,
        int row,
        int col,
        int length
) {

    public static ClueDto from(Clue clue) {
        return new ClueDto(clue.direction(), clue.number(), clue.text(), clue.row(), clue.col(), clue.length());
    }
}
