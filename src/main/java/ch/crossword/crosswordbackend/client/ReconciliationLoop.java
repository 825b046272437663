package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.domain.puzzle.CellCoord;
import ch.crossword.crosswordbackend.domain.session.CellState;
import ch.crossword.crosswordbackend.domain.session.PuzzleAction;
import ch.crossword.crosswordbackend.domain.session.PuzzleSession;
import ch.crossword.crosswordbackend.web.api.dto.CellStateDto;
import ch.crossword.crosswordbackend.web.api.dto.GameStateDto;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Replaces a client's local fill map with the server's authoritative one.
 *
 * <p>Runs after the channel is subscribed, when the client becomes visible again and after every
 * failed claim. A failed fetch leaves the local state untouched; the next trigger tries again.
 */
@Slf4j
public class ReconciliationLoop {

    private final GameGateway gateway;
    private final UUID gameId;
    private final PuzzleSession session;
    private final Consumer<GameStateDto> onState;

    /**
     * @param onState receives every fetched snapshot after the cells were hydrated, for players and status
     */
    public ReconciliationLoop(GameGateway gateway, UUID gameId, PuzzleSession session, Consumer<GameStateDto> onState) {
        this.gateway = gateway;
        this.gameId = gameId;
        this.session = session;
        this.onState = onState;
    }

    public Optional<GameStateDto> reconcile() {
        Optional<GameStateDto> fetched = gateway.fetchGameState(gameId);
        if (fetched.isEmpty()) {
            log.warn("Reconciliation of game {} skipped, state unavailable", gameId);
            return Optional.empty();
        }

        GameStateDto state = fetched.get();
        Map<CellCoord, CellState> cells = toCells(state.cells());
        int score = (int) cells.values().stream().filter(CellState::correct).count();
        session.dispatch(new PuzzleAction.HydrateCells(cells, score));
        onState.accept(state);

        log.debug("Game {} hydrated with {} cells", gameId, cells.size());
        return fetched;
    }

    static Map<CellCoord, CellState> toCells(Map<String, CellStateDto> cells) {
        Map<CellCoord, CellState> result = new HashMap<>();
        if (cells == null) {
            return result;
        }
        cells.forEach((key, cell) -> result.put(
                CellCoord.fromKey(key),
                new CellState(cell.letter(), cell.correct(), cell.ownerId())
        ));
        return result;
    }
}
