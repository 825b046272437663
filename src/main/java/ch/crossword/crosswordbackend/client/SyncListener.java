package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;

/**
 * Callbacks of a {@link SyncChannel}.
 */
public interface SyncListener {

    /**
     * The subscription to the game's topic is active. Called once per {@link SyncChannel#open}.
     */
    void onSubscribed();

    void onEvent(GameEventDto event);
}
