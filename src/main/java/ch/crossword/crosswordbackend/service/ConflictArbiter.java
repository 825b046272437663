package ch.crossword.crosswordbackend.service;

import ch.crossword.crosswordbackend.domain.ClueCredit;
import ch.crossword.crosswordbackend.domain.Game;
import ch.crossword.crosswordbackend.domain.Player;
import ch.crossword.crosswordbackend.domain.enums.ClaimOutcome;
import ch.crossword.crosswordbackend.domain.enums.GameStatus;
import ch.crossword.crosswordbackend.domain.puzzle.CellCoord;
import ch.crossword.crosswordbackend.domain.puzzle.Clue;
import ch.crossword.crosswordbackend.domain.puzzle.ClueProgress;
import ch.crossword.crosswordbackend.domain.puzzle.GridTopology;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;
import ch.crossword.crosswordbackend.repository.GameRepository;
import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.UUID;

/**
 * Decides who owns a cell when several players race to fill it.
 *
 * <p>Each claim runs in its own transaction that first takes a write lock on the game row.
 * Concurrent claims on the same game are therefore serialized: exactly one of several claims on
 * the same cell sees the cell empty and is granted, all later ones see it taken and are denied.
 *
 * <p>Correctness of the letter is asserted by the caller and not re-checked against the solution.
 */
@Service
@Slf4j
public class ConflictArbiter {

    private final GameRepository gameRepository;
    private final PuzzleService puzzleService;
    private final GameEventPublisher eventPublisher;

    public ConflictArbiter(GameRepository gameRepository,
                           PuzzleService puzzleService,
                           GameEventPublisher eventPublisher) {
        this.gameRepository = gameRepository;
        this.puzzleService = puzzleService;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Claims a cell for a player.
     *
     * <p>Denied when the game is not {@code ACTIVE}, when {@code isCorrect} is {@code false}, or
     * when the cell is already claimed. A granted claim stores the letter with the player as owner,
     * increments the player's score, credits the player with every word the cell completes and,
     * if this was the last empty cell, completes the game.
     *
     * @param gameId game to claim in
     * @param cellKey cell in the form {@code "row,col"}
     * @param letter letter to place
     * @param playerId claiming player
     * @param isCorrect the caller's correctness check
     * @return {@link ClaimOutcome#GRANTED} or {@link ClaimOutcome#DENIED}
     * @throws EntityNotFoundException if the game does not exist
     * @throws IllegalArgumentException if the cell key or letter is malformed, or the cell is a block
     * @throws IllegalStateException if the player does not belong to the game
     */
    @Transactional
    public ClaimOutcome claimCell(UUID gameId, String cellKey, String letter, UUID playerId, boolean isCorrect) {
        Game game = gameRepository.findByIdForUpdate(gameId)
                .orElseThrow(() -> new EntityNotFoundException("Game not found: " + gameId));

        if (game.getStatus() != GameStatus.ACTIVE) {
            log.debug("Claim {} in game {} denied: status {}", cellKey, gameId, game.getStatus());
            return ClaimOutcome.DENIED;
        }
        if (!isCorrect) {
            log.debug("Claim {} in game {} denied: not correct", cellKey, gameId);
            return ClaimOutcome.DENIED;
        }
        if (letter == null || letter.length() != 1) {
            throw new IllegalArgumentException("Letter must be a single character: " + letter);
        }

        CellCoord cell = CellCoord.fromKey(cellKey);
        PuzzleModel puzzle = puzzleService.toModel(game.getPuzzle());
        if (GridTopology.isBlack(puzzle, cell.row(), cell.col())) {
            throw new IllegalArgumentException("Cell " + cellKey + " is not fillable");
        }

        Player player = game.findPlayer(playerId)
                .orElseThrow(() -> new IllegalStateException("Player does not belong to this game"));

        String key = cell.key();
        if (game.isCellClaimed(key)) {
            log.debug("Claim {} in game {} denied: already claimed", key, gameId);
            return ClaimOutcome.DENIED;
        }

        // evaluated before the write: words whose other cells are all claimed
        for (Clue clue : ClueProgress.newlyCompletedClues(puzzle, c -> game.isCellClaimed(c.key()), cell.row(), cell.col())) {
            game.addClueCredit(new ClueCredit(clue.direction(), clue.number(), playerId));
        }

        game.claimCell(key, letter.toUpperCase(Locale.ROOT), playerId);
        player.incrementScore();

        boolean completed = game.isFilled() && game.transitionTo(GameStatus.COMPLETED);
        gameRepository.save(game);

        log.debug("Claim {} in game {} granted to player {}", key, gameId, playerId);
        if (completed) {
            log.info("Game {} completed", gameId);
            eventPublisher.publish(gameId, GameEventDto.gameCompleted(gameId));
        }
        return ClaimOutcome.GRANTED;
    }
}
