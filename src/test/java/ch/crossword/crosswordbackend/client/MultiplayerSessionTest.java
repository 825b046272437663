package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.domain.enums.ClaimOutcome;
import ch.crossword.crosswordbackend.domain.enums.GameStatus;
import ch.crossword.crosswordbackend.domain.puzzle.CellCoord;
import ch.crossword.crosswordbackend.domain.session.CellState;
import ch.crossword.crosswordbackend.domain.session.PuzzleSession;
import ch.crossword.crosswordbackend.domain.session.SessionState;
import ch.crossword.crosswordbackend.testutil.TestPuzzles;
import ch.crossword.crosswordbackend.web.api.dto.CellStateDto;
import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;
import ch.crossword.crosswordbackend.web.api.dto.PlayerDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Two players on one in-memory hub against a fake backend.
 */
class MultiplayerSessionTest {

    private final UUID gameId = UUID.randomUUID();
    private final PlayerDto alice = new PlayerDto(UUID.randomUUID(), "alice", "Alice", "#3b82f6", 0);
    private final PlayerDto bob = new PlayerDto(UUID.randomUUID(), "bob", "Bob", "#ef4444", 0);

    private InMemorySyncHub hub;
    private FakeGameGateway gateway;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        hub = new InMemorySyncHub();
        gateway = new FakeGameGateway(gameId, TestPuzzles.catModel());
        gateway.players.add(alice);
        gateway.players.add(bob);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    }

    private MultiplayerSession sessionFor(PlayerDto player) {
        PuzzleSession puzzleSession = new PuzzleSession();
        puzzleSession.loadPuzzle(TestPuzzles.catModel());
        return new MultiplayerSession(gameId, player, puzzleSession, gateway, hub.newChannel(), clock);
    }

    private static SessionState state(MultiplayerSession session) {
        return session.getPuzzleSession().getState();
    }

    // ------------------------------------------------------------------------------------
    // connect / presence
    // ------------------------------------------------------------------------------------

    @Test
    void connect_shouldHydrateFromServer_andLoadPlayersAndStatus() {
        gateway.cells.put("2,2", new CellStateDto("T", true, bob.id()));
        MultiplayerSession session = sessionFor(alice);

        session.connect();

        assertThat(state(session).fillMap()).containsEntry(new CellCoord(2, 2), new CellState("T", true, bob.id()));
        assertThat(state(session).score()).isEqualTo(1);
        assertThat(session.getStatus()).isEqualTo(GameStatus.ACTIVE);
        assertThat(session.getPlayers()).extracting(PlayerDto::userId).containsExactly("alice", "bob");
        assertThat(session.isHost()).isTrue();
    }

    @Test
    void playerJoined_shouldBeAddedOnce_perUserId() {
        gateway.players.remove(bob);
        MultiplayerSession aliceSession = sessionFor(alice);
        aliceSession.connect();

        gateway.players.add(bob);
        MultiplayerSession bobSession = sessionFor(bob);
        bobSession.connect();
        hub.broadcast(gameId, GameEventDto.playerJoined(gameId, bob));

        assertThat(aliceSession.getPlayers()).extracting(PlayerDto::userId).containsExactly("alice", "bob");
        assertThat(bobSession.isHost()).isFalse();
    }

    @Test
    void lifecycleEvents_shouldUpdateStatusAndPlayers() {
        gateway.status = GameStatus.WAITING;
        MultiplayerSession session = sessionFor(bob);
        session.connect();
        assertThat(session.getStatus()).isEqualTo(GameStatus.WAITING);

        hub.broadcast(gameId, GameEventDto.gameStarted(gameId));
        assertThat(session.getStatus()).isEqualTo(GameStatus.ACTIVE);

        hub.broadcast(gameId, GameEventDto.playerLeft(gameId, alice.id()));
        assertThat(session.getPlayers()).extracting(PlayerDto::userId).containsExactly("bob");

        hub.broadcast(gameId, GameEventDto.roomClosed(gameId));
        assertThat(session.isRoomClosed()).isTrue();
    }

    // ------------------------------------------------------------------------------------
    // claims
    // ------------------------------------------------------------------------------------

    @Test
    void claimCell_granted_shouldBroadcastToOtherPlayer() {
        MultiplayerSession aliceSession = sessionFor(alice);
        MultiplayerSession bobSession = sessionFor(bob);
        aliceSession.connect();
        bobSession.connect();

        Optional<ClaimOutcome> outcome = aliceSession.claimCell(0, 0, "c");

        assertThat(outcome).contains(ClaimOutcome.GRANTED);
        assertThat(state(aliceSession).fillMap()).containsEntry(new CellCoord(0, 0), new CellState("C", true, alice.id()));
        assertThat(state(bobSession).fillMap()).containsEntry(new CellCoord(0, 0), new CellState("C", true, alice.id()));
        assertThat(state(aliceSession).score()).isEqualTo(1);
        assertThat(state(bobSession).score()).isEqualTo(1);
    }

    @Test
    void claimCell_onCellAlreadyCorrectLocally_shouldNotAskServer() {
        MultiplayerSession aliceSession = sessionFor(alice);
        MultiplayerSession bobSession = sessionFor(bob);
        aliceSession.connect();
        bobSession.connect();
        aliceSession.claimCell(0, 0, "C");
        int claimsBefore = gateway.claimCalls;

        Optional<ClaimOutcome> outcome = bobSession.claimCell(0, 0, "C");

        assertThat(outcome).isEmpty();
        assertThat(gateway.claimCalls).isEqualTo(claimsBefore);
        assertThat(state(bobSession).fillMap().get(new CellCoord(0, 0)).ownerId()).isEqualTo(alice.id());
    }

    @Test
    void claimCell_lostRace_shouldRollBackAndAdoptWinner() {
        MultiplayerSession aliceSession = sessionFor(alice);
        aliceSession.connect();
        // bob's claim reached the server, his event did not reach alice yet
        gateway.cells.put("0,1", new CellStateDto("A", true, bob.id()));

        Optional<ClaimOutcome> outcome = aliceSession.claimCell(0, 1, "A");

        assertThat(outcome).contains(ClaimOutcome.DENIED);
        assertThat(state(aliceSession).fillMap()).containsEntry(new CellCoord(0, 1), new CellState("A", true, bob.id()));
        assertThat(state(aliceSession).score()).isEqualTo(1);
    }

    @Test
    void claimCell_unreachable_shouldRollBackOptimisticLetter() {
        MultiplayerSession aliceSession = sessionFor(alice);
        aliceSession.connect();
        gateway.unreachable = true;

        Optional<ClaimOutcome> outcome = aliceSession.claimCell(0, 1, "A");

        assertThat(outcome).contains(ClaimOutcome.UNREACHABLE);
        assertThat(state(aliceSession).fillMap()).isEmpty();
        assertThat(state(aliceSession).score()).isZero();
    }

    @Test
    void claimCell_wrongLetter_shouldLockInputForConfiguredTimeout() {
        gateway.wrongAnswerTimeoutSeconds = 3;
        MultiplayerSession session = sessionFor(alice);
        session.connect();

        assertThat(session.claimCell(0, 0, "X")).isEmpty();
        assertThat(session.isLockedOut()).isTrue();
        assertThat(session.claimCell(0, 0, "C")).isEmpty();
        assertThat(state(session).fillMap()).isEmpty();

        clock.advance(Duration.ofSeconds(3));

        assertThat(session.isLockedOut()).isFalse();
        assertThat(session.claimCell(0, 0, "C")).contains(ClaimOutcome.GRANTED);
    }

    @Test
    void claimCell_wrongLetter_withoutTimeout_shouldNotLock() {
        MultiplayerSession session = sessionFor(alice);
        session.connect();

        assertThat(session.claimCell(0, 0, "X")).isEmpty();

        assertThat(session.isLockedOut()).isFalse();
        assertThat(gateway.claimCalls).isZero();
    }

    @Test
    void claimCell_onBlock_shouldBeIgnored() {
        MultiplayerSession session = sessionFor(alice);
        session.connect();

        assertThat(session.claimCell(1, 1, "X")).isEmpty();
        assertThat(gateway.claimCalls).isZero();
    }

    // ------------------------------------------------------------------------------------
    // completion / reconciliation
    // ------------------------------------------------------------------------------------

    @Test
    void lastClaim_shouldCompleteLocallyAndNotifyServerOnce() {
        MultiplayerSession aliceSession = sessionFor(alice);
        MultiplayerSession bobSession = sessionFor(bob);
        aliceSession.connect();
        bobSession.connect();
        String[][] aliceCells = {{"0", "0", "C"}, {"0", "1", "A"}, {"0", "2", "T"}, {"1", "0", "A"}};
        String[][] bobCells = {{"1", "2", "O"}, {"2", "0", "B"}, {"2", "1", "E"}, {"2", "2", "T"}};

        for (String[] c : aliceCells) {
            aliceSession.claimCell(Integer.parseInt(c[0]), Integer.parseInt(c[1]), c[2]);
        }
        for (String[] c : bobCells) {
            bobSession.claimCell(Integer.parseInt(c[0]), Integer.parseInt(c[1]), c[2]);
        }

        assertThat(state(aliceSession).isComplete()).isTrue();
        assertThat(state(bobSession).isComplete()).isTrue();
        assertThat(aliceSession.getStatus()).isEqualTo(GameStatus.COMPLETED);
        assertThat(bobSession.getStatus()).isEqualTo(GameStatus.COMPLETED);
        assertThat(gateway.status).isEqualTo(GameStatus.COMPLETED);
        // both clients notice, the server transition is idempotent
        assertThat(gateway.completeCalls).isEqualTo(2);
    }

    @Test
    void onVisible_shouldPickUpCellsMissedWhileHidden() {
        MultiplayerSession session = sessionFor(alice);
        session.connect();
        gateway.cells.put("2,0", new CellStateDto("B", true, bob.id()));
        gateway.cells.put("2,1", new CellStateDto("E", true, bob.id()));

        session.onVisible();

        assertThat(state(session).fillMap()).containsOnlyKeys(new CellCoord(2, 0), new CellCoord(2, 1));
        assertThat(state(session).score()).isEqualTo(2);
    }

    @Test
    void disconnect_shouldStopReceivingEvents() {
        MultiplayerSession aliceSession = sessionFor(alice);
        MultiplayerSession bobSession = sessionFor(bob);
        aliceSession.connect();
        bobSession.connect();

        bobSession.disconnect();
        aliceSession.claimCell(0, 0, "C");

        assertThat(state(bobSession).fillMap()).isEmpty();
        assertThat(hub.subscriberCount(gameId)).isEqualTo(1);
    }

    @Test
    void startAndClose_shouldGoThroughGateway() {
        gateway.status = GameStatus.WAITING;
        MultiplayerSession session = sessionFor(alice);
        session.connect();

        assertThat(session.startGame()).isTrue();
        assertThat(gateway.status).isEqualTo(GameStatus.ACTIVE);
        assertThat(session.closeRoom()).isTrue();
        assertThat(gateway.status).isEqualTo(GameStatus.CLOSED);
        assertThat(session.leave()).isTrue();
        assertThat(gateway.players).extracting(PlayerDto::userId).containsExactly("bob");
    }
}
