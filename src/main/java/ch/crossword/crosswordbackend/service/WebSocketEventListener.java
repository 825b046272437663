package ch.crossword.crosswordbackend.service;

import ch.crossword.crosswordbackend.domain.Game;
import ch.crossword.crosswordbackend.domain.Player;
import ch.crossword.crosswordbackend.domain.PlayerConnection;
import ch.crossword.crosswordbackend.repository.GameRepository;
import ch.crossword.crosswordbackend.repository.PlayerConnectionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks player presence from STOMP session events.
 *
 * <p>A subscription to {@code /topic/games/{gameId}/events} carrying a {@code playerId} header
 * registers (or revives) a {@link PlayerConnection}. When the session closes, the connection is
 * marked disconnected and a check is scheduled after the grace period: a player that has not
 * subscribed again by then is removed from the game, which broadcasts {@code PLAYER_LEFT}.
 * Page reloads and short network drops stay within the grace period and go unnoticed.
 */
@Component
@Slf4j
public class WebSocketEventListener {

    private static final String TOPIC_PREFIX = "/topic/games/";
    private static final String TOPIC_SUFFIX = "/events";

    private final PlayerConnectionRepository connectionRepository;
    private final GameRepository gameRepository;
    private final GameService gameService;
    private final TaskScheduler taskScheduler;
    private final Duration gracePeriod;

    public WebSocketEventListener(PlayerConnectionRepository connectionRepository,
                                  GameRepository gameRepository,
                                  GameService gameService,
                                  @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                                  @Value("${crossword.presence.disconnect-grace-period:15s}") Duration gracePeriod) {
        this.connectionRepository = connectionRepository;
        this.gameRepository = gameRepository;
        this.gameService = gameService;
        this.taskScheduler = taskScheduler;
        this.gracePeriod = gracePeriod;
    }

    @EventListener
    @Transactional
    public void handleSubscribe(SessionSubscribeEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();
        String destination = accessor.getDestination();

        if (sessionId == null || destination == null) {
            return;
        }
        if (!destination.startsWith(TOPIC_PREFIX) || !destination.endsWith(TOPIC_SUFFIX)) {
            return;
        }

        List<String> playerIdHeaders = accessor.getNativeHeader("playerId");
        if (playerIdHeaders == null || playerIdHeaders.isEmpty()) {
            // spectators subscribe without a player id
            log.debug("Subscription to {} without playerId header", destination);
            return;
        }

        try {
            UUID gameId = extractGameId(destination);
            UUID playerId = UUID.fromString(playerIdHeaders.get(0));
            registerConnection(gameId, playerId, sessionId);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring subscription to {} with playerId {}: {}", destination, playerIdHeaders.get(0), e.getMessage());
        }
    }

    @EventListener
    @Transactional
    public void handleDisconnect(SessionDisconnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();
        if (sessionId == null) {
            return;
        }

        Optional<PlayerConnection> connectionOpt = connectionRepository.findBySessionId(sessionId);
        if (connectionOpt.isEmpty()) {
            log.debug("Disconnect for untracked session: {}", sessionId);
            return;
        }

        PlayerConnection connection = connectionOpt.get();
        connection.markDisconnected();
        connectionRepository.save(connection);

        UUID connectionId = connection.getId();
        taskScheduler.schedule(
                () -> removeIfStillDisconnected(connectionId, sessionId),
                Instant.now().plus(gracePeriod)
        );

        log.info("Player {} disconnected from game {}, removal check in {}",
                connection.getPlayer().getDisplayName(), connection.getGame().getId(), gracePeriod);
    }

    /**
     * Runs on the scheduler thread once the grace period is over.
     *
     * @param lostSessionId the session whose loss scheduled this check
     */
    void removeIfStillDisconnected(UUID connectionId, String lostSessionId) {
        Optional<PlayerConnection> connectionOpt = connectionRepository.findByIdWithPlayerAndGame(connectionId);
        if (connectionOpt.isEmpty()) {
            log.debug("Connection {} no longer exists, skipping removal", connectionId);
            return;
        }

        PlayerConnection connection = connectionOpt.get();
        Game game = connection.getGame();
        Player player = connection.getPlayer();

        if (!connection.isStillDownFrom(lostSessionId)) {
            // a newer disconnect has its own check
            log.info("Player {} reconnected to game {} within the grace period", player.getDisplayName(), game.getId());
            return;
        }
        if (!game.getStatus().isJoinable()) {
            log.debug("Game {} is {}, keeping player {}", game.getId(), game.getStatus(), player.getDisplayName());
            return;
        }

        log.info("Player {} still disconnected after {}, removing from game {}", player.getDisplayName(), gracePeriod, game.getId());
        gameService.leaveGame(game.getId(), player.getId());
    }

    private void registerConnection(UUID gameId, UUID playerId, String sessionId) {
        Game game = gameRepository.findById(gameId).orElse(null);
        if (game == null) {
            log.warn("Connection registration for unknown game: {}", gameId);
            return;
        }

        Player player = game.findPlayer(playerId).orElse(null);
        if (player == null) {
            log.warn("Connection registration for unknown player {} in game {}", playerId, gameId);
            return;
        }

        Optional<PlayerConnection> existing = connectionRepository.findByGameAndPlayer(game, player);
        if (existing.isPresent()) {
            PlayerConnection conn = existing.get();
            boolean wasDisconnected = !conn.isConnected();
            conn.markReconnected(sessionId);
            connectionRepository.save(conn);
            log.info("Player {} {} to game {}", player.getDisplayName(),
                    wasDisconnected ? "reconnected" : "updated connection", gameId);
        } else {
            connectionRepository.save(new PlayerConnection(game, player, sessionId));
            log.info("New connection registered for player {} in game {}", player.getDisplayName(), gameId);
        }
    }

    /**
     * @throws IllegalArgumentException if the destination does not carry a game id
     */
    static UUID extractGameId(String destination) {
        if (destination.length() <= TOPIC_PREFIX.length() + TOPIC_SUFFIX.length()) {
            throw new IllegalArgumentException("No game id in " + destination);
        }
        String id = destination.substring(TOPIC_PREFIX.length(), destination.length() - TOPIC_SUFFIX.length());
        return UUID.fromString(id);
    }
}
