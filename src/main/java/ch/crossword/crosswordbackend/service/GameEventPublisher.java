package ch.crossword.crosswordbackend.service;

import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;

/**
 * Publishes game events to all clients subscribed to a game's topic.
 *
 * <p>Inside a transaction the event is held back until the commit, so a client reacting to it
 * reads the committed state. Events of a rolled back transaction are dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;

    public static String topicFor(UUID gameId) {
        return "/topic/games/" + gameId + "/events";
    }

    public void publish(UUID gameId, GameEventDto event) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            send(gameId, event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                send(gameId, event);
            }
        });
        log.debug("Queued {} event for game {} until commit", event.type(), gameId);
    }

    private void send(UUID gameId, GameEventDto event) {
        messagingTemplate.convertAndSend(topicFor(gameId), event);
        log.debug("Sent {} event for game {}", event.type(), gameId);
    }
}
