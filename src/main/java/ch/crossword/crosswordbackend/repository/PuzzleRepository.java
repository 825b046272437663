package ch.crossword.crosswordbackend.repository;

import ch.crossword.crosswordbackend.domain.Puzzle;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface PuzzleRepository extends JpaRepository<Puzzle, UUID> {

    Optional<Puzzle> findByContentHash(String contentHash);
}
