package ch.crossword.crosswordbackend.repository;

import ch.crossword.crosswordbackend.domain.Game;
import ch.crossword.crosswordbackend.domain.Player;
import ch.crossword.crosswordbackend.domain.PlayerConnection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link PlayerConnection} entities, used for presence tracking.
 */
public interface PlayerConnectionRepository extends JpaRepository<PlayerConnection, UUID> {

    Optional<PlayerConnection> findBySessionId(String sessionId);

    Optional<PlayerConnection> findByGameAndPlayer(Game game, Player player);

    /**
     * Loads a connection with player and game fetched, for grace period checks that run on the
     * scheduler thread outside of any request.
     */
    @Query("SELECT pc FROM PlayerConnection pc " +
            "JOIN FETCH pc.player " +
            "JOIN FETCH pc.game " +
            "WHERE pc.id = :id")
    Optional<PlayerConnection> findByIdWithPlayerAndGame(@Param("id") UUID id);
}
