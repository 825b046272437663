package ch.crossword.crosswordbackend.web.api.controller;

import ch.crossword.crosswordbackend.domain.enums.GameStatus;
import ch.crossword.crosswordbackend.repository.GameRepository;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness probe, with a count of games per open status.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final GameRepository gameRepository;

    public HealthController(GameRepository gameRepository) {
        this.gameRepository = gameRepository;
    }

    @Operation(summary = "Service status and number of waiting and active games")
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("waitingGames", gameRepository.countByStatus(GameStatus.WAITING));
        body.put("activeGames", gameRepository.countByStatus(GameStatus.ACTIVE));
        return body;
    }
}
