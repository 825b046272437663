package ch.crossword.crosswordbackend.service;

import ch.crossword.crosswordbackend.domain.ClueEntry;
import ch.crossword.crosswordbackend.domain.Puzzle;
import ch.crossword.crosswordbackend.domain.enums.Direction;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;
import ch.crossword.crosswordbackend.repository.PuzzleRepository;
import ch.crossword.crosswordbackend.web.api.dto.ClueTextDto;
import ch.crossword.crosswordbackend.web.api.dto.ImportPuzzleRequest;
import ch.crossword.crosswordbackend.web.api.dto.PuzzleDto;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static ch.crossword.crosswordbackend.testutil.EntityTestUtils.setId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PuzzleServiceTest {

    @Mock
    private PuzzleRepository puzzleRepository;

    @InjectMocks
    private PuzzleService puzzleService;

    private static final List<ClueTextDto> CLUES = List.of(
            new ClueTextDto(Direction.ACROSS, 1, "Feline"),
            new ClueTextDto(Direction.ACROSS, 3, "Wager"),
            new ClueTextDto(Direction.DOWN, 1, "Taxi"),
            new ClueTextDto(Direction.DOWN, 2, "Toddler")
    );

    @Test
    void importPuzzle_shouldNormalizeRows_andStoreNewPuzzle() {
        when(puzzleRepository.findByContentHash(anyString())).thenReturn(Optional.empty());
        when(puzzleRepository.save(any(Puzzle.class))).thenAnswer(inv -> {
            Puzzle p = inv.getArgument(0);
            setId(p, UUID.randomUUID());
            return p;
        });
        ArgumentCaptor<Puzzle> puzzleCaptor = ArgumentCaptor.forClass(Puzzle.class);

        PuzzleDto dto = puzzleService.importPuzzle(new ImportPuzzleRequest(" ", "Me", List.of("cat", "a.o", "bet"), CLUES));

        verify(puzzleRepository).save(puzzleCaptor.capture());
        Puzzle saved = puzzleCaptor.getValue();
        assertThat(saved.getGridRows()).containsExactly("CAT", "A#O", "BET");
        assertThat(saved.getTitle()).isEqualTo("Untitled");
        assertThat(saved.getWidth()).isEqualTo(3);
        assertThat(dto.id()).isNotNull();
        assertThat(dto.clues()).hasSize(4);
        assertThat(dto.clues().get(2).text()).isEqualTo("Taxi");
    }

    @Test
    void importPuzzle_sameGridAgain_shouldRefreshCluesOfExistingPuzzle() {
        Puzzle existing = new Puzzle("Cats", "Me", List.of("CAT", "A#O", "BET"),
                List.of(new ClueEntry(Direction.ACROSS, 1, "Old")), "hash");
        setId(existing, UUID.randomUUID());
        when(puzzleRepository.findByContentHash(anyString())).thenReturn(Optional.of(existing));
        when(puzzleRepository.save(existing)).thenReturn(existing);

        PuzzleDto dto = puzzleService.importPuzzle(new ImportPuzzleRequest("Cats", "Me", List.of("CAT", "A#O", "BET"), CLUES));

        assertThat(dto.id()).isEqualTo(existing.getId());
        assertThat(existing.getClues()).extracting(ClueEntry::getText).containsExactly("Feline", "Wager", "Taxi", "Toddler");
    }

    @Test
    void importPuzzle_shouldRejectMalformedGrid_withoutTouchingRepository() {
        assertThatThrownBy(() -> puzzleService.importPuzzle(
                new ImportPuzzleRequest("Bad", null, List.of("CAT", "A#"), List.of())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> puzzleService.importPuzzle(
                new ImportPuzzleRequest("Bad", null, List.of(), List.of())))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(puzzleRepository);
    }

    @Test
    void loadPuzzle_shouldBuildModelFromStoredRowsAndClues() {
        UUID id = UUID.randomUUID();
        Puzzle stored = new Puzzle("Cats", "Me", List.of("CAT", "A#O", "BET"),
                List.of(new ClueEntry(Direction.DOWN, 2, "Toddler")), "hash");
        when(puzzleRepository.findById(id)).thenReturn(Optional.of(stored));

        PuzzleModel model = puzzleService.loadPuzzle(id);

        assertThat(model.fillableCellCount()).isEqualTo(8);
        assertThat(model.clues()).singleElement().satisfies(c -> assertThat(c.answer()).isEqualTo("TOT"));
    }

    @Test
    void getPuzzle_shouldThrow_whenUnknown() {
        UUID id = UUID.randomUUID();
        when(puzzleRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> puzzleService.getPuzzle(id)).isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void contentHash_shouldIgnorePromptsAndClueOrder_butNotGrid() {
        List<String> rows = List.of("CAT", "A#O", "BET");
        List<ClueTextDto> reordered = List.of(
                new ClueTextDto(Direction.DOWN, 2, "other"),
                new ClueTextDto(Direction.DOWN, 1, "other"),
                new ClueTextDto(Direction.ACROSS, 3, "other"),
                new ClueTextDto(Direction.ACROSS, 1, "other")
        );

        assertThat(PuzzleService.contentHash(rows, CLUES)).isEqualTo(PuzzleService.contentHash(rows, reordered));
        assertThat(PuzzleService.contentHash(rows, CLUES)).hasSize(64);
        assertThat(PuzzleService.contentHash(List.of("COT", "A#O", "BET"), CLUES))
                .isNotEqualTo(PuzzleService.contentHash(rows, CLUES));
    }
}
