package ch.crossword.crosswordbackend.web.api.controller;

import ch.crossword.crosswordbackend.service.GameEventPublisher;
import ch.crossword.crosswordbackend.service.GameService;
import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

import java.time.Instant;
import java.util.UUID;

/**
 * Relays events published by clients on {@code /app/games/{gameId}/events} to the game's topic.
 *
 * <p>Only {@code CELL_CLAIMED} and {@code PLAYER_JOINED} are accepted, and only from players of
 * the game; a {@code CELL_CLAIMED} must match a cell the sender actually owns. Everything else is
 * dropped.
 */
@Controller
@Slf4j
public class GameEventRelayController {

    private final GameService gameService;
    private final GameEventPublisher eventPublisher;

    public GameEventRelayController(GameService gameService, GameEventPublisher eventPublisher) {
        this.gameService = gameService;
        this.eventPublisher = eventPublisher;
    }

    @MessageMapping("/games/{gameId}/events")
    public void relay(@Payload GameEventDto incoming, @DestinationVariable UUID gameId) {
        if (!gameService.isRelayable(gameId, incoming)) {
            log.warn("Dropped {} event for game {} from {}",
                    incoming == null ? null : incoming.type(), gameId, incoming == null ? null : incoming.senderId());
            return;
        }

        GameEventDto event = new GameEventDto(
                incoming.type(),
                gameId,
                Instant.now(),
                incoming.row(),
                incoming.col(),
                incoming.letter(),
                incoming.playerId(),
                incoming.player()
        );
        eventPublisher.publish(gameId, event);
    }
}
