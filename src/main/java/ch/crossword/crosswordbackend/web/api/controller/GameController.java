package ch.crossword.crosswordbackend.web.api.controller;

import ch.crossword.crosswordbackend.domain.enums.ClaimOutcome;
import ch.crossword.crosswordbackend.service.ConflictArbiter;
import ch.crossword.crosswordbackend.service.GameService;
import ch.crossword.crosswordbackend.web.api.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/games")
public class GameController {

    private final GameService gameService;
    private final ConflictArbiter conflictArbiter;

    public GameController(GameService gameService, ConflictArbiter conflictArbiter) {
        this.gameService = gameService;
        this.conflictArbiter = conflictArbiter;
    }

    @Operation(summary = "Create a solo game or a multiplayer room")
    @PostMapping
    public ResponseEntity<CreateGameResponseDto> createGame(@RequestBody CreateGameRequest request) {
        try {
            return ResponseEntity.ok(gameService.createGame(request));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Join a game by its room code")
    @PostMapping("/join/{shortCode}")
    public ResponseEntity<JoinGameResponseDto> joinGame(@PathVariable String shortCode,
                                                        @RequestBody JoinGameRequest request) {
        try {
            return ResponseEntity.ok(gameService.joinGame(shortCode, request));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Rejoin a game after a reload")
    @PostMapping("/{gameId}/rejoin")
    public ResponseEntity<JoinGameResponseDto> rejoinGame(@PathVariable UUID gameId,
                                                          @RequestBody JoinGameRequest request) {
        try {
            return ResponseEntity.ok(gameService.rejoinGame(gameId, request));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Get the authoritative game state (cells, players, status)")
    @GetMapping("/{gameId}")
    public ResponseEntity<GameStateDto> getGame(@PathVariable UUID gameId) {
        try {
            return ResponseEntity.ok(gameService.getGameState(gameId));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Claim a cell. Exactly one of several concurrent claims on a cell is granted")
    @PostMapping("/{gameId}/claims")
    public ResponseEntity<ClaimResultDto> claimCell(@PathVariable UUID gameId,
                                                    @RequestBody ClaimCellRequest request) {
        try {
            ClaimOutcome outcome = conflictArbiter.claimCell(
                    gameId,
                    request.cellKey(),
                    request.letter(),
                    request.playerId(),
                    request.correct()
            );
            return ResponseEntity.ok(new ClaimResultDto(outcome));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Start a waiting game (host only)")
    @PostMapping("/{gameId}/start")
    public ResponseEntity<GameStateDto> startGame(@PathVariable UUID gameId,
                                                  @RequestBody HostActionRequest request) {
        try {
            return ResponseEntity.ok(gameService.startGame(gameId, request.userId()));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Close the room (host only, terminal)")
    @PostMapping("/{gameId}/close")
    public ResponseEntity<GameStateDto> closeRoom(@PathVariable UUID gameId,
                                                  @RequestBody HostActionRequest request) {
        try {
            return ResponseEntity.ok(gameService.closeRoom(gameId, request.userId()));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Leave a game")
    @PostMapping("/{gameId}/leave")
    public ResponseEntity<Void> leaveGame(@PathVariable UUID gameId,
                                          @RequestBody PlayerActionRequest request) {
        try {
            gameService.leaveGame(gameId, request.playerId());
            return ResponseEntity.noContent().build();
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Move the room to a new puzzle, keeping its code (host only)")
    @PostMapping("/{gameId}/next")
    public ResponseEntity<CreateGameResponseDto> createNextGame(@PathVariable UUID gameId,
                                                                @RequestBody NextGameRequest request) {
        try {
            return ResponseEntity.ok(gameService.createNextGame(gameId, request));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Complete the game if every cell is claimed (idempotent)")
    @PostMapping("/{gameId}/complete")
    public ResponseEntity<GameStateDto> completeGame(@PathVariable UUID gameId) {
        try {
            return ResponseEntity.ok(gameService.completeGame(gameId));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Update the game status following the lifecycle rules")
    @PutMapping("/{gameId}/status")
    public ResponseEntity<GameStateDto> updateStatus(@PathVariable UUID gameId,
                                                     @RequestBody UpdateStatusRequest request) {
        try {
            return ResponseEntity.ok(gameService.updateGameStatus(gameId, request.status()));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Cells and completed words per player")
    @GetMapping("/{gameId}/scoreboard")
    public ResponseEntity<List<ScoreboardEntryDto>> getScoreboard(@PathVariable UUID gameId) {
        try {
            return ResponseEntity.ok(gameService.getScoreboard(gameId));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
