package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.domain.enums.ClaimOutcome;
import ch.crossword.crosswordbackend.domain.enums.GameStatus;
import ch.crossword.crosswordbackend.domain.puzzle.CellCoord;
import ch.crossword.crosswordbackend.domain.puzzle.GridTopology;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleCell;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;
import ch.crossword.crosswordbackend.domain.session.PuzzleAction;
import ch.crossword.crosswordbackend.domain.session.PuzzleSession;
import ch.crossword.crosswordbackend.domain.session.SessionState;
import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;
import ch.crossword.crosswordbackend.web.api.dto.GameStateDto;
import ch.crossword.crosswordbackend.web.api.dto.PlayerDto;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One player's side of a shared game.
 *
 * <p>Correct letters are applied locally first, then claimed at the server. A granted claim is
 * broadcast to the other players; a denied or unreachable one is rolled back and the local state
 * is reconciled with the server. Events from other players are merged into the local state
 * without overwriting cells that are already correct.
 */
@Slf4j
public class MultiplayerSession implements SyncListener {

    private final UUID gameId;
    private final PlayerDto self;
    private final PuzzleSession puzzleSession;
    private final GameGateway gateway;
    private final SyncChannel channel;
    private final Clock clock;
    private final ReconciliationLoop reconciliation;

    private List<PlayerDto> players = new ArrayList<>();
    private GameStatus status = GameStatus.WAITING;
    private int wrongAnswerTimeoutSeconds;
    private Instant lockedUntil;
    private boolean roomClosed;
    private boolean announced;

    public MultiplayerSession(UUID gameId,
                              PlayerDto self,
                              PuzzleSession puzzleSession,
                              GameGateway gateway,
                              SyncChannel channel,
                              Clock clock) {
        this.gameId = gameId;
        this.self = self;
        this.puzzleSession = puzzleSession;
        this.gateway = gateway;
        this.channel = channel;
        this.clock = clock;
        this.reconciliation = new ReconciliationLoop(gateway, gameId, puzzleSession, this::applyServerState);
    }

    /**
     * Opens the channel. Hydration and the join announcement follow once subscribed.
     */
    public synchronized void connect() {
        announced = false;
        channel.open(gameId, self.id(), this);
    }

    public synchronized void disconnect() {
        channel.close();
    }

    @Override
    public synchronized void onSubscribed() {
        if (!channel.isOpen()) {
            // disconnected while subscribing
            return;
        }
        reconciliation.reconcile();
        if (!announced) {
            announced = true;
            channel.publish(GameEventDto.playerJoined(gameId, self));
        }
    }

    @Override
    public synchronized void onEvent(GameEventDto event) {
        if (event == null || event.type() == null) {
            return;
        }
        switch (event.type()) {
            case CELL_CLAIMED -> onCellClaimed(event);
            case PLAYER_JOINED -> onPlayerJoined(event.player());
            case PLAYER_LEFT -> players.removeIf(p -> Objects.equals(p.id(), event.playerId()));
            case GAME_STARTED -> status = GameStatus.ACTIVE;
            case GAME_COMPLETED -> status = GameStatus.COMPLETED;
            case ROOM_CLOSED -> {
                roomClosed = true;
                status = GameStatus.CLOSED;
            }
        }
    }

    /**
     * Client became visible again; events may have been missed meanwhile.
     */
    public synchronized void onVisible() {
        reconciliation.reconcile();
    }

    /**
     * Types a letter into a cell.
     *
     * @return the claim outcome, or empty if no claim was made (locked out, block, wrong letter,
     * cell already correct)
     */
    public synchronized Optional<ClaimOutcome> claimCell(int row, int col, String letter) {
        SessionState state = puzzleSession.getState();
        PuzzleModel puzzle = state.puzzle();
        if (puzzle == null || letter == null || isLockedOut() || GridTopology.isBlack(puzzle, row, col)) {
            return Optional.empty();
        }

        CellCoord cell = new CellCoord(row, col);
        if (!cell.equals(state.selectedCell())) {
            puzzleSession.selectCell(row, col);
        }
        if (puzzleSession.getState().isCorrect(cell)) {
            // only moves the cursor on
            puzzleSession.inputLetter(letter, self.id());
            return Optional.empty();
        }

        PuzzleCell target = puzzle.cellAt(row, col);
        String upper = letter.toUpperCase(Locale.ROOT);
        if (!upper.equals(target.solution())) {
            if (wrongAnswerTimeoutSeconds > 0) {
                lockedUntil = clock.instant().plus(Duration.ofSeconds(wrongAnswerTimeoutSeconds));
                log.debug("Wrong letter at {}, input locked for {}s", cell.key(), wrongAnswerTimeoutSeconds);
            }
            return Optional.empty();
        }

        puzzleSession.inputLetter(upper, self.id());
        ClaimOutcome outcome = gateway.claimCell(gameId, cell.key(), upper, self.id(), true);
        if (outcome.isGranted()) {
            channel.publish(GameEventDto.cellClaimed(gameId, row, col, upper, self.id()));
        } else {
            log.debug("Claim {} in game {} {}, rolling back", cell.key(), gameId, outcome);
            puzzleSession.dispatch(new PuzzleAction.RollbackCell(row, col, self.id()));
            reconciliation.reconcile();
        }
        checkCompletion();
        return Optional.of(outcome);
    }

    public synchronized boolean startGame() {
        return gateway.startGame(gameId, self.userId());
    }

    public synchronized boolean closeRoom() {
        return gateway.closeRoom(gameId, self.userId());
    }

    public synchronized boolean leave() {
        boolean left = gateway.leaveGame(gameId, self.id());
        channel.close();
        return left;
    }

    public synchronized List<PlayerDto> getPlayers() {
        return List.copyOf(players);
    }

    public synchronized GameStatus getStatus() {
        return status;
    }

    /**
     * The host is the first player by join order.
     */
    public synchronized boolean isHost() {
        return !players.isEmpty() && Objects.equals(players.get(0).userId(), self.userId());
    }

    public synchronized boolean isRoomClosed() {
        return roomClosed;
    }

    public synchronized boolean isLockedOut() {
        return lockedUntil != null && clock.instant().isBefore(lockedUntil);
    }

    public PuzzleSession getPuzzleSession() {
        return puzzleSession;
    }

    private void onCellClaimed(GameEventDto event) {
        if (Objects.equals(event.playerId(), self.id()) || event.row() == null || event.col() == null) {
            return;
        }
        puzzleSession.dispatch(new PuzzleAction.RemoteCellClaim(event.row(), event.col(), event.letter(), event.playerId()));
        checkCompletion();
    }

    private void onPlayerJoined(PlayerDto player) {
        if (player == null) {
            return;
        }
        boolean known = players.stream().anyMatch(p -> Objects.equals(p.userId(), player.userId()));
        if (!known) {
            players.add(player);
        }
    }

    private void applyServerState(GameStateDto state) {
        players = new ArrayList<>(state.players() == null ? List.of() : state.players());
        if (state.status() != null) {
            status = state.status();
            if (status == GameStatus.CLOSED) {
                roomClosed = true;
            }
        }
        wrongAnswerTimeoutSeconds = state.wrongAnswerTimeoutSeconds();
        checkCompletion();
    }

    private void checkCompletion() {
        if (status == GameStatus.ACTIVE && puzzleSession.isComplete()) {
            status = GameStatus.COMPLETED;
            log.info("Game {} complete on this client", gameId);
            gateway.completeGame(gameId);
        }
    }
}
