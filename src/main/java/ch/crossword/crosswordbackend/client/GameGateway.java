package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.domain.enums.ClaimOutcome;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;
import ch.crossword.crosswordbackend.web.api.dto.GameStateDto;

import java.util.Optional;
import java.util.UUID;

/**
 * Client view of the authoritative game store.
 *
 * <p>Implementations never throw on transport problems: claims report
 * {@link ClaimOutcome#UNREACHABLE}, lookups return empty and commands return {@code false}.
 */
public interface GameGateway {

    Optional<PuzzleModel> loadPuzzle(UUID puzzleId);

    Optional<GameStateDto> fetchGameState(UUID gameId);

    ClaimOutcome claimCell(UUID gameId, String cellKey, String letter, UUID playerId, boolean correct);

    boolean startGame(UUID gameId, String userId);

    boolean closeRoom(UUID gameId, String userId);

    boolean leaveGame(UUID gameId, UUID playerId);

    /**
     * Asks the server to complete the game. A no-op on the server unless every cell is claimed.
     */
    boolean completeGame(UUID gameId);
}
