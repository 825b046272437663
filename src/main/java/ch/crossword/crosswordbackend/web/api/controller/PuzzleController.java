package ch.crossword.crosswordbackend.web.api.controller;

import ch.crossword.crosswordbackend.service.PuzzleService;
import ch.crossword.crosswordbackend.web.api.dto.ImportPuzzleRequest;
import ch.crossword.crosswordbackend.web.api.dto.PuzzleDto;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/puzzles")
public class PuzzleController {

    private final PuzzleService puzzleService;

    public PuzzleController(PuzzleService puzzleService) {
        this.puzzleService = puzzleService;
    }

    @Operation(summary = "Import a puzzle (re-importing the same grid refreshes its clues)")
    @PostMapping
    public ResponseEntity<PuzzleDto> importPuzzle(@RequestBody ImportPuzzleRequest request) {
        try {
            return ResponseEntity.ok(puzzleService.importPuzzle(request));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Get a stored puzzle")
    @GetMapping("/{puzzleId}")
    public ResponseEntity<PuzzleDto> getPuzzle(@PathVariable UUID puzzleId) {
        try {
            return ResponseEntity.ok(puzzleService.getPuzzle(puzzleId));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
