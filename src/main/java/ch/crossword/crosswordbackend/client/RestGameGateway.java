package ch.crossword.crosswordbackend.client;

import ch.crossword.crosswordbackend.domain.enums.ClaimOutcome;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleFactory;
import ch.crossword.crosswordbackend.domain.puzzle.PuzzleModel;
import ch.crossword.crosswordbackend.web.api.dto.ClaimCellRequest;
import ch.crossword.crosswordbackend.web.api.dto.ClaimResultDto;
import ch.crossword.crosswordbackend.web.api.dto.GameStateDto;
import ch.crossword.crosswordbackend.web.api.dto.HostActionRequest;
import ch.crossword.crosswordbackend.web.api.dto.PlayerActionRequest;
import ch.crossword.crosswordbackend.web.api.dto.PuzzleDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;
import java.util.UUID;

/**
 * {@link GameGateway} over the backend's REST API.
 *
 * <p>A 4xx answer to a claim means the server refused it ({@link ClaimOutcome#DENIED}); any other
 * failure means it could not be asked ({@link ClaimOutcome#UNREACHABLE}).
 */
@Slf4j
public class RestGameGateway implements GameGateway {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    /**
     * @param restTemplate template used for all calls
     * @param baseUrl backend root, e.g. {@code http://localhost:8080}
     */
    public RestGameGateway(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public Optional<PuzzleModel> loadPuzzle(UUID puzzleId) {
        try {
            PuzzleDto dto = restTemplate.getForObject(baseUrl + "/api/puzzles/{id}", PuzzleDto.class, puzzleId);
            if (dto == null) {
                return Optional.empty();
            }
            return Optional.of(PuzzleFactory.fromRows(
                    dto.title(),
                    dto.author(),
                    dto.rows(),
                    dto.clues().stream()
                            .map(c -> new PuzzleFactory.ClueText(c.direction(), c.number(), c.text()))
                            .toList()
            ));
        } catch (RestClientException e) {
            log.warn("Loading puzzle {} failed: {}", puzzleId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<GameStateDto> fetchGameState(UUID gameId) {
        try {
            return Optional.ofNullable(restTemplate.getForObject(baseUrl + "/api/games/{id}", GameStateDto.class, gameId));
        } catch (RestClientException e) {
            log.warn("Fetching state of game {} failed: {}", gameId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public ClaimOutcome claimCell(UUID gameId, String cellKey, String letter, UUID playerId, boolean correct) {
        try {
            ClaimResultDto result = restTemplate.postForObject(
                    baseUrl + "/api/games/{id}/claims",
                    new ClaimCellRequest(cellKey, letter, playerId, correct),
                    ClaimResultDto.class,
                    gameId
            );
            return result == null || result.outcome() == null ? ClaimOutcome.UNREACHABLE : result.outcome();
        } catch (HttpClientErrorException e) {
            log.debug("Claim {} in game {} rejected with {}", cellKey, gameId, e.getStatusCode());
            return ClaimOutcome.DENIED;
        } catch (RestClientException e) {
            log.warn("Claim {} in game {} unreachable: {}", cellKey, gameId, e.getMessage());
            return ClaimOutcome.UNREACHABLE;
        }
    }

    @Override
    public boolean startGame(UUID gameId, String userId) {
        return post("/api/games/{id}/start", new HostActionRequest(userId), gameId);
    }

    @Override
    public boolean closeRoom(UUID gameId, String userId) {
        return post("/api/games/{id}/close", new HostActionRequest(userId), gameId);
    }

    @Override
    public boolean leaveGame(UUID gameId, UUID playerId) {
        return post("/api/games/{id}/leave", new PlayerActionRequest(playerId), gameId);
    }

    @Override
    public boolean completeGame(UUID gameId) {
        return post("/api/games/{id}/complete", null, gameId);
    }

    private boolean post(String path, Object body, UUID gameId) {
        try {
            restTemplate.postForEntity(baseUrl + path, body, Void.class, gameId);
            return true;
        } catch (RestClientException e) {
            log.warn("POST {} for game {} failed: {}", path, gameId, e.getMessage());
            return false;
        }
    }
}
