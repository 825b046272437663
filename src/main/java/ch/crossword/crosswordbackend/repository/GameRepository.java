package ch.crossword.crosswordbackend.repository;

import ch.crossword.crosswordbackend.domain.Game;
import ch.crossword.crosswordbackend.domain.enums.GameStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface GameRepository extends JpaRepository<Game, UUID> {

    boolean existsByShortCode(String shortCode);

    long countByStatus(GameStatus status);

    /**
     * Loads the game and holds a write lock on its row until the surrounding transaction ends
     * ({@code SELECT ... FOR UPDATE}). Concurrent callers for the same game queue up here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM Game g WHERE g.id = :id")
    Optional<Game> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Room-code lookup with the same write lock as {@link #findByIdForUpdate(UUID)}, so joins to
     * one room are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM Game g WHERE g.shortCode = :shortCode")
    Optional<Game> findByShortCodeForUpdate(@Param("shortCode") String shortCode);
}
