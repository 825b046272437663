package ch.crossword.crosswordbackend.service;

import ch.crossword.crosswordbackend.domain.enums.ClaimOutcome;
import ch.crossword.crosswordbackend.domain.enums.Direction;
import ch.crossword.crosswordbackend.domain.enums.GameStatus;
import ch.crossword.crosswordbackend.web.api.dto.ClueTextDto;
import ch.crossword.crosswordbackend.web.api.dto.CreateGameRequest;
import ch.crossword.crosswordbackend.web.api.dto.CreateGameResponseDto;
import ch.crossword.crosswordbackend.web.api.dto.GameStateDto;
import ch.crossword.crosswordbackend.web.api.dto.ImportPuzzleRequest;
import ch.crossword.crosswordbackend.web.api.dto.JoinGameRequest;
import ch.crossword.crosswordbackend.web.api.dto.PlayerDto;
import ch.crossword.crosswordbackend.web.api.dto.PuzzleDto;
import ch.crossword.crosswordbackend.web.api.dto.ScoreboardEntryDto;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Races several players for the same cell against the real database lock.
 */
@SpringBootTest
class ConflictArbiterConcurrencyTest {

    private static final int PLAYERS = 6;

    @Autowired
    private PuzzleService puzzleService;

    @Autowired
    private GameService gameService;

    @Autowired
    private ConflictArbiter conflictArbiter;

    @Test
    void concurrentClaimsOnSameCell_shouldGrantExactlyOne() throws Exception {
        // Arrange
        PuzzleDto puzzle = puzzleService.importPuzzle(new ImportPuzzleRequest("Race", "Test",
                List.of("CAT", "A#O", "BET"),
                List.of(new ClueTextDto(Direction.ACROSS, 1, "Feline"), new ClueTextDto(Direction.DOWN, 1, "Taxi"))));

        CreateGameResponseDto created = gameService.createGame(
                new CreateGameRequest(puzzle.id(), "user-0", "Player 0", true, false, null));
        UUID gameId = created.gameId();
        List<UUID> playerIds = new ArrayList<>();
        playerIds.add(created.playerId());
        for (int i = 1; i < PLAYERS; i++) {
            PlayerDto joined = gameService.joinGame(created.shortCode(), new JoinGameRequest("user-" + i, "Player " + i)).player();
            playerIds.add(joined.id());
        }
        gameService.startGame(gameId, "user-0");

        ExecutorService pool = Executors.newFixedThreadPool(PLAYERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ClaimOutcome>> results = new ArrayList<>();

        // Act
        for (UUID playerId : playerIds) {
            results.add(pool.submit(() -> {
                start.await();
                return conflictArbiter.claimCell(gameId, "0,0", "C", playerId, true);
            }));
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        List<ClaimOutcome> outcomes = new ArrayList<>();
        for (Future<ClaimOutcome> result : results) {
            outcomes.add(result.get());
        }

        // Assert
        assertThat(outcomes).filteredOn(ClaimOutcome::isGranted).hasSize(1);
        assertThat(outcomes).filteredOn(o -> o == ClaimOutcome.DENIED).hasSize(PLAYERS - 1);

        GameStateDto state = gameService.getGameState(gameId);
        assertThat(state.status()).isEqualTo(GameStatus.ACTIVE);
        assertThat(state.cells()).containsOnlyKeys("0,0");
        UUID owner = state.cells().get("0,0").ownerId();
        assertThat(playerIds).contains(owner);

        List<ScoreboardEntryDto> board = gameService.getScoreboard(gameId);
        assertThat(board).extracting(ScoreboardEntryDto::cells).containsOnly(0, 1);
        assertThat(board).filteredOn(e -> e.playerId().equals(owner)).singleElement()
                .satisfies(e -> assertThat(e.cells()).isEqualTo(1));
    }
}
