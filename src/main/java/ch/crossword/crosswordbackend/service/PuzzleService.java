package ch.crossword.crosswordbackend.service;

import ch.crossword.crosswordbackend.domain.ClueEntry;
import ch.crossword.crosswordbackend.domain.Puzzle;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleFactory;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;
import ch.crossword.crosswordbackend.repository.PuzzleRepository;
import ch.crossword.crosswordbackend.web.api.dto.ClueDto;
import ch.crossword.crosswordbackend.web.api.dto.ClueTextDto;
import ch.crossword.crosswordbackend.web.api.dto.ImportPuzzleRequest;
import ch.crossword.crosswordbackend.web.api.dto.PuzzleDto;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores puzzles and turns them into validated {@link PuzzleModel}s.
 *
 * <p>Imports are deduplicated by a SHA-256 hash over the grid and the clue slots. Importing the
 * same puzzle again returns the stored one and refreshes its clue prompts.
 */
@Service
@Transactional
@Slf4j
public class PuzzleService {

    private final PuzzleRepository puzzleRepository;

    public PuzzleService(PuzzleRepository puzzleRepository) {
        this.puzzleRepository = puzzleRepository;
    }

    public PuzzleDto importPuzzle(ImportPuzzleRequest request) {
        if (request == null || request.rows() == null || request.rows().isEmpty()) {
            throw new IllegalArgumentException("Puzzle must have at least one row");
        }
        String title = request.title() == null || request.title().isBlank() ? "Untitled" : request.title().trim();
        List<String> rows = normalizeRows(request.rows());
        List<ClueTextDto> clueTexts = request.clues() == null ? List.of() : request.clues();

        // fails fast on a malformed grid or clue
        PuzzleModel model = PuzzleFactory.fromRows(title, request.author(), rows, toClueTexts(clueTexts));
        List<ClueEntry> entries = clueTexts.stream()
                .map(c -> new ClueEntry(c.direction(), c.number(), c.text()))
                .toList();

        String hash = contentHash(rows, clueTexts);
        Optional<Puzzle> existing = puzzleRepository.findByContentHash(hash);
        if (existing.isPresent()) {
            Puzzle puzzle = existing.get();
            puzzle.replaceClues(entries);
            log.info("Puzzle {} imported again, clue texts refreshed", puzzle.getId());
            return toDto(puzzleRepository.save(puzzle), model);
        }

        Puzzle saved = puzzleRepository.save(new Puzzle(title, request.author(), rows, entries, hash));
        log.info("Imported puzzle {} '{}' ({}x{})", saved.getId(), title, model.width(), model.height());
        return toDto(saved, model);
    }

    @Transactional(readOnly = true)
    public PuzzleDto getPuzzle(UUID puzzleId) {
        Puzzle puzzle = findPuzzle(puzzleId);
        return toDto(puzzle, toModel(puzzle));
    }

    /**
     * Loads a stored puzzle as an immutable model.
     *
     * @throws EntityNotFoundException if no puzzle has the given id
     */
    @Transactional(readOnly = true)
    public PuzzleModel loadPuzzle(UUID puzzleId) {
        return toModel(findPuzzle(puzzleId));
    }

    public PuzzleModel toModel(Puzzle puzzle) {
        List<PuzzleFactory.ClueText> clueTexts = puzzle.getClues().stream()
                .map(c -> new PuzzleFactory.ClueText(c.getDirection(), c.getNumber(), c.getText()))
                .toList();
        return PuzzleFactory.fromRows(puzzle.getTitle(), puzzle.getAuthor(), puzzle.getGridRows(), clueTexts);
    }

    private Puzzle findPuzzle(UUID puzzleId) {
        return puzzleRepository.findById(puzzleId)
                .orElseThrow(() -> new EntityNotFoundException("Puzzle not found: " + puzzleId));
    }

    private static List<String> normalizeRows(List<String> rows) {
        return rows.stream()
                .map(r -> r == null ? "" : r.trim().toUpperCase(Locale.ROOT).replace('.', '#'))
                .toList();
    }

    private static List<PuzzleFactory.ClueText> toClueTexts(List<ClueTextDto> clues) {
        return clues.stream()
                .map(c -> new PuzzleFactory.ClueText(c.direction(), c.number(), c.text()))
                .toList();
    }

    /**
     * Hash over rows and clue slots (direction and number), but not the prompts, so that fixed
     * prompts of the same puzzle still match.
     */
    static String contentHash(List<String> rows, List<ClueTextDto> clues) {
        StringBuilder sb = new StringBuilder();
        rows.forEach(r -> sb.append(r).append('\n'));
        clues.stream()
                .sorted(Comparator.comparing(ClueTextDto::direction).thenComparingInt(ClueTextDto::number))
                .forEach(c -> sb.append(c.direction()).append('-').append(c.number()).append('\n'));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static PuzzleDto toDto(Puzzle puzzle, PuzzleModel model) {
        return new PuzzleDto(
                puzzle.getId(),
                model.title(),
                model.author(),
                model.width(),
                model.height(),
                List.copyOf(puzzle.getGridRows()),
                model.clues().stream().map(ClueDto::from).toList()
        );
    }
}
