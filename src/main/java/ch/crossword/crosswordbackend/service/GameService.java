package ch.crossword.crosswordbackend.service;

import ch.crossword.crosswordbackend.domain.ClueCredit;
import ch.crossword.crosswordbackend.domain.FilledCell;
import ch.crossword.crosswordbackend.domain.Game;
import ch.crossword.crosswordbackend.domain.GameSettings;
import ch.crossword.crosswordbackend.domain.Player;
import ch.crossword.crosswordbackend.domain.Puzzle;
import ch.crossword.crosswordbackend.domain.enums.GameEventType;
import ch.crossword.crosswordbackend.domain.enums.GameStatus;
import ch.crossword.crosswordbackend.domain.puzzle.CellCoord;
import ch.crossword.crosswordbackend.domain.puzzle.ClueProgress;
import ch.crossword.crosswordbackend.repository.GameRepository;
import ch.crossword.crosswordbackend.repository.PlayerConnectionRepository;
import ch.crossword.crosswordbackend.repository.PuzzleRepository;
import ch.crossword.crosswordbackend.web.api.dto.*;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Game store: creating games and rooms, joining, lifecycle transitions and snapshots.
 *
 * <p>Cell claims do not go through this service but through {@link ConflictArbiter}.
 */
@Service
@Transactional
@Slf4j
public class GameService {

    static final String DEFAULT_DISPLAY_NAME = "Player 1";

    private final GameRepository gameRepository;
    private final PuzzleRepository puzzleRepository;
    private final PlayerConnectionRepository connectionRepository;
    private final PuzzleService puzzleService;
    private final ShortCodeGenerator shortCodeGenerator;
    private final GameEventPublisher eventPublisher;

    public GameService(GameRepository gameRepository,
                       PuzzleRepository puzzleRepository,
                       PlayerConnectionRepository connectionRepository,
                       PuzzleService puzzleService,
                       ShortCodeGenerator shortCodeGenerator,
                       GameEventPublisher eventPublisher) {
        this.gameRepository = gameRepository;
        this.puzzleRepository = puzzleRepository;
        this.connectionRepository = connectionRepository;
        this.puzzleService = puzzleService;
        this.shortCodeGenerator = shortCodeGenerator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Creates a game on a stored puzzle.
     *
     * <p>Multiplayer games start {@code WAITING} with a fresh room code, solo games start
     * {@code ACTIVE} without one. Unless the host is a spectator, the host joins as first player.
     */
    public CreateGameResponseDto createGame(CreateGameRequest request) {
        requireUserId(request.userId());
        Puzzle puzzle = findPuzzle(request.puzzleId());

        GameStatus status = request.multiplayer() ? GameStatus.WAITING : GameStatus.ACTIVE;
        String shortCode = request.multiplayer() ? shortCodeGenerator.nextUniqueCode() : null;

        Game game = new Game(
                puzzle,
                status,
                shortCode,
                request.userId(),
                settingsOf(request.wrongAnswerTimeoutSeconds()),
                puzzleService.toModel(puzzle).fillableCellCount()
        );
        if (!request.spectator()) {
            game.addPlayer(new Player(request.userId(), displayNameOrDefault(request.displayName()), PlayerColors.colorFor(0)));
        }

        Game saved = gameRepository.saveAndFlush(game);
        log.info("Created {} game {} (code {})", request.multiplayer() ? "multiplayer" : "solo", saved.getId(), shortCode);

        return new CreateGameResponseDto(
                saved.getId(),
                saved.getShortCode(),
                saved.getStatus(),
                saved.findPlayerByUserId(request.userId()).map(Player::getId).orElse(null)
        );
    }

    /**
     * Joins a game by room code. Joining again with the same {@code userId} returns the existing
     * player unchanged.
     *
     * @throws EntityNotFoundException if no game has the code
     * @throws IllegalStateException if the game is completed or closed
     */
    public JoinGameResponseDto joinGame(String shortCode, JoinGameRequest request) {
        requireUserId(request.userId());
        String code = shortCode == null ? "" : shortCode.trim().toUpperCase(Locale.ROOT);
        Game game = gameRepository.findByShortCodeForUpdate(code)
                .orElseThrow(() -> new EntityNotFoundException("Game not found: " + code));

        return join(game, request);
    }

    /**
     * Rejoins a game by id, e.g. after a page reload. Creates the player again if it went missing.
     *
     * @throws EntityNotFoundException if the game does not exist
     * @throws IllegalStateException if the game is completed or closed
     */
    public JoinGameResponseDto rejoinGame(UUID gameId, JoinGameRequest request) {
        requireUserId(request.userId());
        return join(findGameForUpdate(gameId), request);
    }

    /**
     * Expects the game to be loaded under its row lock: the player list and the join index of
     * the new player must not change between the check and the insert.
     */
    private JoinGameResponseDto join(Game game, JoinGameRequest request) {
        if (!game.getStatus().isJoinable()) {
            throw new IllegalStateException("Cannot join a game that is " + game.getStatus());
        }

        if (game.findPlayerByUserId(request.userId()).isEmpty()) {
            String color = PlayerColors.colorFor(game.getPlayers().size());
            game.addPlayer(new Player(request.userId(), displayNameOrDefault(request.displayName()), color));
            game = gameRepository.saveAndFlush(game);
            log.info("User {} joined game {}", request.userId(), game.getId());
        }

        Player player = game.findPlayerByUserId(request.userId())
                .orElseThrow(() -> new IllegalStateException("Joined player not found"));
        return new JoinGameResponseDto(PlayerDto.from(player), GameStateDto.from(game));
    }

    /**
     * Moves a room on to a new puzzle: the current game releases its room code and a new
     * {@code WAITING} game takes it over.
     *
     * @throws IllegalStateException if the caller is not the host or the game has no room code
     */
    public CreateGameResponseDto createNextGame(UUID gameId, NextGameRequest request) {
        Game current = findGame(gameId);
        requireHost(current, request.userId());

        String shortCode = current.getShortCode();
        if (shortCode == null) {
            throw new IllegalStateException("Game " + gameId + " has no room code");
        }
        Puzzle puzzle = findPuzzle(request.puzzleId());

        current.setShortCode(null);
        gameRepository.saveAndFlush(current);

        Game next = new Game(
                puzzle,
                GameStatus.WAITING,
                shortCode,
                request.userId(),
                settingsOf(request.wrongAnswerTimeoutSeconds()),
                puzzleService.toModel(puzzle).fillableCellCount()
        );
        if (!request.spectator()) {
            next.addPlayer(new Player(request.userId(), displayNameOrDefault(request.displayName()), PlayerColors.colorFor(0)));
        }
        Game saved = gameRepository.saveAndFlush(next);
        log.info("Room {} moved from game {} to game {}", shortCode, gameId, saved.getId());

        return new CreateGameResponseDto(
                saved.getId(),
                shortCode,
                saved.getStatus(),
                saved.findPlayerByUserId(request.userId()).map(Player::getId).orElse(null)
        );
    }

    /**
     * Host starts a waiting game. Broadcasts {@code GAME_STARTED}.
     */
    public GameStateDto startGame(UUID gameId, String userId) {
        Game game = findGame(gameId);
        requireHost(game, userId);

        if (game.getStatus() != GameStatus.WAITING) {
            throw new IllegalStateException("Can only start a WAITING game");
        }
        game.transitionTo(GameStatus.ACTIVE);
        Game saved = gameRepository.save(game);

        log.info("Game {} started with {} players", gameId, saved.getPlayers().size());
        eventPublisher.publish(gameId, GameEventDto.gameStarted(gameId));
        return GameStateDto.from(saved);
    }

    /**
     * Host closes the room. Broadcasts {@code ROOM_CLOSED}; closing twice is a no-op.
     */
    public GameStateDto closeRoom(UUID gameId, String userId) {
        Game game = findGame(gameId);
        requireHost(game, userId);

        if (game.transitionTo(GameStatus.CLOSED)) {
            eventPublisher.publish(gameId, GameEventDto.roomClosed(gameId));
            log.info("Room of game {} closed", gameId);
        }
        return GameStateDto.from(gameRepository.save(game));
    }

    /**
     * Removes a player from the game and broadcasts {@code PLAYER_LEFT}. Cells the player
     * claimed stay claimed. Also used for players whose connection did not come back within the
     * disconnect grace period.
     */
    public void leaveGame(UUID gameId, UUID playerId) {
        Game game = findGame(gameId);
        Player player = game.findPlayer(playerId)
                .orElseThrow(() -> new IllegalStateException("Player does not belong to this game"));
        removePlayer(game, player);
    }

    private void removePlayer(Game game, Player player) {
        connectionRepository.findByGameAndPlayer(game, player).ifPresent(connectionRepository::delete);
        game.removePlayer(player);
        gameRepository.save(game);

        log.info("Player {} left game {}", player.getDisplayName(), game.getId());
        eventPublisher.publish(game.getId(), GameEventDto.playerLeft(game.getId(), player.getId()));
    }

    @Transactional(readOnly = true)
    public GameStateDto getGameState(UUID gameId) {
        return GameStateDto.from(findGame(gameId));
    }

    /**
     * Generic status update following the lifecycle rules. Setting the current status again is
     * a no-op; status events are broadcast only on an actual change.
     *
     * @throws IllegalStateException if the transition is not allowed, or completion is requested
     *                               before every cell is claimed
     */
    public GameStateDto updateGameStatus(UUID gameId, GameStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("Status must not be null");
        }
        Game game = status == GameStatus.COMPLETED
                ? findGameForUpdate(gameId)
                : findGame(gameId);

        if (status == GameStatus.COMPLETED && game.getStatus() != GameStatus.COMPLETED && !game.isFilled()) {
            throw new IllegalStateException("Cannot complete a game with empty cells");
        }
        if (game.transitionTo(status)) {
            log.info("Game {} moved to {}", gameId, status);
            eventPublisher.publish(gameId, eventFor(gameId, status));
        }
        return GameStateDto.from(gameRepository.save(game));
    }

    /**
     * Completes the game if it is active and every fillable cell is claimed. Safe to call any
     * number of times: only the call that performs the transition broadcasts {@code GAME_COMPLETED}.
     */
    public GameStateDto completeGame(UUID gameId) {
        Game game = findGameForUpdate(gameId);
        if (game.getStatus() == GameStatus.ACTIVE && game.isFilled()) {
            game.transitionTo(GameStatus.COMPLETED);
            gameRepository.save(game);
            log.info("Game {} completed", gameId);
            eventPublisher.publish(gameId, GameEventDto.gameCompleted(gameId));
        }
        return GameStateDto.from(game);
    }

    /**
     * Checks whether a client-published event may be relayed to the game's topic: the sender
     * must be a player of the game, and a claimed cell must actually be owned by the sender.
     */
    @Transactional(readOnly = true)
    public boolean isRelayable(UUID gameId, GameEventDto event) {
        if (event == null || event.type() == null || !event.type().isClientOriginated()) {
            return false;
        }
        Game game = gameRepository.findById(gameId).orElse(null);
        UUID senderId = event.senderId();
        if (game == null || senderId == null || game.findPlayer(senderId).isEmpty()) {
            return false;
        }
        if (event.type() == GameEventType.CELL_CLAIMED) {
            if (event.row() == null || event.col() == null) {
                return false;
            }
            FilledCell cell = game.getCells().get(new CellCoord(event.row(), event.col()).key());
            return cell != null && senderId.equals(cell.getOwnerId());
        }
        return true;
    }

    /**
     * Scoreboard in join order: claimed cells and completed words per player.
     */
    @Transactional(readOnly = true)
    public List<ScoreboardEntryDto> getScoreboard(UUID gameId) {
        Game game = findGame(gameId);
        Map<UUID, Integer> clues = ClueProgress.countCluesPerPlayer(
                game.getClueCredits().stream().map(ClueCredit::getPlayerId).toList()
        );
        return game.getPlayers().stream()
                .map(p -> new ScoreboardEntryDto(
                        p.getId(),
                        p.getDisplayName(),
                        p.getColor(),
                        p.getScore(),
                        clues.getOrDefault(p.getId(), 0)))
                .toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Game findGame(UUID gameId) {
        return gameRepository.findById(gameId)
                .orElseThrow(() -> new EntityNotFoundException("Game not found: " + gameId));
    }

    private Game findGameForUpdate(UUID gameId) {
        return gameRepository.findByIdForUpdate(gameId)
                .orElseThrow(() -> new EntityNotFoundException("Game not found: " + gameId));
    }

    private Puzzle findPuzzle(UUID puzzleId) {
        if (puzzleId == null) {
            throw new IllegalArgumentException("puzzleId must not be null");
        }
        return puzzleRepository.findById(puzzleId)
                .orElseThrow(() -> new EntityNotFoundException("Puzzle not found: " + puzzleId));
    }

    private static void requireHost(Game game, String userId) {
        if (!game.isHost(userId)) {
            throw new IllegalStateException("Only the host may do this");
        }
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }

    private static String displayNameOrDefault(String displayName) {
        return displayName == null || displayName.isBlank() ? DEFAULT_DISPLAY_NAME : displayName.trim();
    }

    private static GameSettings settingsOf(Integer wrongAnswerTimeoutSeconds) {
        return wrongAnswerTimeoutSeconds == null
                ? GameSettings.defaultSettings()
                : GameSettings.of(wrongAnswerTimeoutSeconds);
    }

    private static GameEventDto eventFor(UUID gameId, GameStatus status) {
        return switch (status) {
            case ACTIVE -> GameEventDto.gameStarted(gameId);
            case COMPLETED -> GameEventDto.gameCompleted(gameId);
            case CLOSED -> GameEventDto.roomClosed(gameId);
            case WAITING -> throw new IllegalStateException("No event for " + status);
        };
    }
}
