package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.service.GameEventPublisher;
import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.lang.reflect.Type;
import java.util.UUID;

/**
 * {@link SyncChannel} over STOMP: subscribes to {@code /topic/games/{gameId}/events} and
 * publishes to {@code /app/games/{gameId}/events}.
 *
 * <p>The subscription carries a {@code playerId} header so the server can track presence.
 */
@Slf4j
public class StompSyncChannel implements SyncChannel {

    private final WebSocketStompClient stompClient;
    private final String url;

    private volatile UUID gameId;
    private volatile SyncListener listener;
    private volatile StompSession session;
    private volatile StompSession.Subscription subscription;

    /**
     * @param url WebSocket endpoint, e.g. {@code ws://localhost:8080/ws}
     */
    public StompSyncChannel(String url) {
        this(createClient(), url);
    }

    public StompSyncChannel(WebSocketStompClient stompClient, String url) {
        this.stompClient = stompClient;
        this.url = url;
    }

    private static WebSocketStompClient createClient() {
        WebSocketStompClient client = new WebSocketStompClient(new StandardWebSocketClient());
        MappingJackson2MessageConverter converter = new MappingJackson2MessageConverter();
        converter.setObjectMapper(Jackson2ObjectMapperBuilder.json().build());
        client.setMessageConverter(converter);
        return client;
    }

    @Override
    public synchronized void open(UUID gameId, UUID playerId, SyncListener listener) {
        if (this.listener != null) {
            throw new IllegalStateException("Channel already open for game " + this.gameId);
        }
        this.gameId = gameId;
        this.listener = listener;

        stompClient.connectAsync(url, new StompSessionHandlerAdapter() {
            @Override
            public void afterConnected(StompSession stompSession, StompHeaders connectedHeaders) {
                onConnected(stompSession, gameId, playerId);
            }

            @Override
            public void handleException(StompSession s, StompCommand command, StompHeaders headers,
                                        byte[] payload, Throwable exception) {
                log.warn("STOMP error on game {}: {}", gameId, exception.getMessage());
            }

            @Override
            public void handleTransportError(StompSession s, Throwable exception) {
                log.warn("STOMP transport error on game {}: {}", gameId, exception.getMessage());
            }
        });
    }

    /**
     * Subscribes on the connected session. The listener is notified after the channel's monitor is
     * released, since it takes its own lock and may close this channel from another thread.
     */
    private void onConnected(StompSession stompSession, UUID openedGameId, UUID playerId) {
        SyncListener target;
        synchronized (this) {
            target = listener;
            if (target == null || !openedGameId.equals(gameId)) {
                // closed while connecting
                stompSession.disconnect();
                return;
            }
            subscribe(stompSession, openedGameId, playerId);
        }
        target.onSubscribed();
    }

    private void subscribe(StompSession stompSession, UUID openedGameId, UUID playerId) {
        this.session = stompSession;

        StompHeaders headers = new StompHeaders();
        headers.setDestination(GameEventPublisher.topicFor(openedGameId));
        if (playerId != null) {
            headers.add("playerId", playerId.toString());
        }
        this.subscription = stompSession.subscribe(headers, new StompFrameHandler() {
            @Override
            public Type getPayloadType(StompHeaders frameHeaders) {
                return GameEventDto.class;
            }

            @Override
            public void handleFrame(StompHeaders frameHeaders, Object payload) {
                SyncListener target = listener;
                if (target != null && payload instanceof GameEventDto event) {
                    target.onEvent(event);
                }
            }
        });
        log.debug("Subscribed to game {} as player {}", openedGameId, playerId);
    }

    @Override
    public void publish(GameEventDto event) {
        StompSession current = session;
        UUID currentGame = gameId;
        if (current == null || currentGame == null || !current.isConnected()) {
            log.debug("Dropped {} event, channel not connected", event.type());
            return;
        }
        current.send("/app/games/" + currentGame + "/events", event);
    }

    @Override
    public synchronized void close() {
        listener = null;
        gameId = null;
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (session != null) {
            session.disconnect();
            session = null;
        }
    }

    @Override
    public boolean isOpen() {
        return listener != null;
    }
}
