package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.domain.enums.ClaimOutcome;
import ch.crossword.crosswordbackend.domain.enums.GameStatus;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;
import ch.crossword.crosswordbackend.web.api.dto.CellStateDto;
import ch.crossword.crosswordbackend.web.api.dto.GameStateDto;
import ch.crossword.crosswordbackend.web.api.dto.PlayerDto;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * In-memory stand-in for the backend, granting the first correct claim per cell.
 */
class FakeGameGateway implements GameGateway {

    final UUID gameId;
    final PuzzleModel puzzle;
    final Map<String, CellStateDto> cells = new TreeMap<>();
    final List<PlayerDto> players = new ArrayList<>();
    GameStatus status = GameStatus.ACTIVE;
    int wrongAnswerTimeoutSeconds;
    boolean unreachable;
    int claimCalls;
    int completeCalls;

    FakeGameGateway(UUID gameId, PuzzleModel puzzle) {
        this.gameId = gameId;
        this.puzzle = puzzle;
    }

    @Override
    public Optional<PuzzleModel> loadPuzzle(UUID puzzleId) {
        return unreachable ? Optional.empty() : Optional.of(puzzle);
    }

    @Override
    public Optional<GameStateDto> fetchGameState(UUID id) {
        if (unreachable) {
            return Optional.empty();
        }
        return Optional.of(new GameStateDto(gameId, "ABC234", status, UUID.randomUUID(),
                puzzle.fillableCellCount(), wrongAnswerTimeoutSeconds, new TreeMap<>(cells), List.copyOf(players)));
    }

    @Override
    public ClaimOutcome claimCell(UUID id, String cellKey, String letter, UUID playerId, boolean correct) {
        claimCalls++;
        if (unreachable) {
            return ClaimOutcome.UNREACHABLE;
        }
        if (status != GameStatus.ACTIVE || !correct || cells.containsKey(cellKey)) {
            return ClaimOutcome.DENIED;
        }
        cells.put(cellKey, new CellStateDto(letter, true, playerId));
        return ClaimOutcome.GRANTED;
    }

    @Override
    public boolean startGame(UUID id, String userId) {
        status = GameStatus.ACTIVE;
        return !unreachable;
    }

    @Override
    public boolean closeRoom(UUID id, String userId) {
        status = GameStatus.CLOSED;
        return !unreachable;
    }

    @Override
    public boolean leaveGame(UUID id, UUID playerId) {
        return !unreachable && players.removeIf(p -> p.id().equals(playerId));
    }

    @Override
    public boolean completeGame(UUID id) {
        completeCalls++;
        if (status == GameStatus.ACTIVE && cells.size() >= puzzle.fillableCellCount()) {
            status = GameStatus.COMPLETED;
        }
        return !unreachable;
    }
}
