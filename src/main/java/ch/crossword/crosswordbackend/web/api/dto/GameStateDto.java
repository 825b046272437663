package ch.crossword.crosswordbackend.web.api.dto;

import ch.crossword.crosswordbackend.domain.Game;
import ch.crossword.crosswordbackend.domain.enums.GameStatus;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Authoritative snapshot of a game, used by clients to reconcile their local replica.
 *
 * @param gameId game id
 * @param shortCode room code, {@code null} for solo games and released rooms
 * @param status current status
 * @param puzzleId puzzle being solved
 * @param fillableCells completion threshold
 * @param wrongAnswerTimeoutSeconds lockout after a wrong letter
 * @param cells claimed cells keyed by {@code "row,col"}
 * @param players players in join order, the first one is the host
 */
public record GameStateDto(
        UUID gameId,
        String shortCode,
        GameStatus status,
        UUID puzzleId,
        int fillableCells,
        int wrongAnswerTimeoutSeconds,
        Map<String, CellStateDto> cells,
        List<PlayerDto> players
) {

    public static GameStateDto from(Game game) {
        Map<String, CellStateDto> cells = new TreeMap<>();
        game.getCells().forEach((key, cell) -> cells.put(key, CellStateDto.from(cell)));

        return new GameStateDto(
                game.getId(),
                game.getShortCode(),
                game.getStatus(),
                game.getPuzzle().getId(),
                game.getFillableCells(),
                game.getSettings() == null ? 0 : game.getSettings().getWrongAnswerTimeoutSeconds(),
                cells,
                game.getPlayers().stream().map(PlayerDto::from).toList()
        );
    }
}
