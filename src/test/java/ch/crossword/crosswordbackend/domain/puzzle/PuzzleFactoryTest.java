package ch.crossword.crosswordbackend.domain.puzzle;

import ch.crossword.crosswordbackend.domain.enums.Direction;
import ch.crossword.crosswordbackend.testutil.TestPuzzles;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PuzzleFactoryTest {

    @Test
    void fromRows_shouldDeriveClues_lengthsAndAnswers() {
        PuzzleModel puzzle = TestPuzzles.catModel();

        assertThat(puzzle.width()).isEqualTo(3);
        assertThat(puzzle.height()).isEqualTo(3);
        assertThat(puzzle.fillableCellCount()).isEqualTo(8);
        assertThat(puzzle.clues())
                .extracting(Clue::key, Clue::answer, Clue::length)
                .containsExactlyInAnyOrder(
                        org.assertj.core.groups.Tuple.tuple("ACROSS-1", "CAT", 3),
                        org.assertj.core.groups.Tuple.tuple("ACROSS-3", "BET", 3),
                        org.assertj.core.groups.Tuple.tuple("DOWN-1", "CAB", 3),
                        org.assertj.core.groups.Tuple.tuple("DOWN-2", "TOT", 3)
                );
        assertThat(puzzle.cellAt(0, 2).number()).isEqualTo(2);
        assertThat(puzzle.cellAt(1, 1).isBlack()).isTrue();
    }

    @Test
    void fromRows_withClueTexts_shouldKeepPromptsAndUpperCaseSolutions() {
        PuzzleModel puzzle = PuzzleFactory.fromRows("Pets", "Me", List.of("cat", "a.o", "bet"), List.of(
                new PuzzleFactory.ClueText(Direction.ACROSS, 1, "Feline"),
                new PuzzleFactory.ClueText(Direction.DOWN, 2, "Small child")
        ));

        assertThat(puzzle.title()).isEqualTo("Pets");
        assertThat(puzzle.clues()).hasSize(2);
        assertThat(puzzle.clues().get(0).text()).isEqualTo("Feline");
        assertThat(puzzle.clues().get(1).answer()).isEqualTo("TOT");
        assertThat(puzzle.cellAt(0, 0).solution()).isEqualTo("C");
    }

    @Test
    void fromRows_shouldRejectClueNumberThatDoesNotStartWordInDirection() {
        List<PuzzleFactory.ClueText> clues = List.of(new PuzzleFactory.ClueText(Direction.ACROSS, 2, "Nope"));

        assertThatThrownBy(() -> PuzzleFactory.fromRows("T", "A", TestPuzzles.CAT_ROWS, clues))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not start");
    }

    @Test
    void fromRows_shouldRejectUnknownClueNumber() {
        List<PuzzleFactory.ClueText> clues = List.of(new PuzzleFactory.ClueText(Direction.DOWN, 9, "Nope"));

        assertThatThrownBy(() -> PuzzleFactory.fromRows("T", "A", TestPuzzles.CAT_ROWS, clues))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromRows_shouldRejectRaggedGridAndInvalidCharacters() {
        assertThatThrownBy(() -> PuzzleFactory.fromRows(List.of("CAT", "AO")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PuzzleFactory.fromRows(List.of("C1T")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PuzzleFactory.fromRows(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
