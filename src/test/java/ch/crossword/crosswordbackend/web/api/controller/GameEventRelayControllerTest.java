package ch.crossword.crosswordbackend.web.api.controller;

import ch.crossword.crosswordbackend.domain.enums.GameEventType;
import ch.crossword.crosswordbackend.service.GameEventPublisher;
import ch.crossword.crosswordbackend.service.GameService;
import ch.crossword.crosswordbackend.web.api.dto.GameEventDto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameEventRelayControllerTest {

    @Mock
    GameService gameService;

    @Mock
    GameEventPublisher eventPublisher;

    @InjectMocks
    GameEventRelayController relayController;

    @Test
    void relay_shouldPublishToPathGame_whenEventIsRelayable() {
        UUID gameId = UUID.randomUUID();
        UUID playerId = UUID.randomUUID();
        // a client may put any game id into the payload, the path wins
        GameEventDto incoming = GameEventDto.cellClaimed(UUID.randomUUID(), 0, 1, "A", playerId);
        when(gameService.isRelayable(gameId, incoming)).thenReturn(true);
        ArgumentCaptor<GameEventDto> captor = ArgumentCaptor.forClass(GameEventDto.class);

        relayController.relay(incoming, gameId);

        verify(eventPublisher).publish(eq(gameId), captor.capture());
        GameEventDto relayed = captor.getValue();
        assertThat(relayed.type()).isEqualTo(GameEventType.CELL_CLAIMED);
        assertThat(relayed.gameId()).isEqualTo(gameId);
        assertThat(relayed.row()).isZero();
        assertThat(relayed.col()).isEqualTo(1);
        assertThat(relayed.playerId()).isEqualTo(playerId);
        assertThat(relayed.timeStamp()).isNotNull();
    }

    @Test
    void relay_shouldDropEvent_whenNotRelayable() {
        UUID gameId = UUID.randomUUID();
        GameEventDto forged = GameEventDto.roomClosed(gameId);
        when(gameService.isRelayable(gameId, forged)).thenReturn(false);

        relayController.relay(forged, gameId);

        verify(eventPublisher, never()).publish(any(), any());
    }
}
