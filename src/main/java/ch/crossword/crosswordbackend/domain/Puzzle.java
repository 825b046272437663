package ch.crossword.crosswordbackend.domain;

import ch.crossword.crosswordbackend.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * A stored crossword puzzle.
 *
 * <p>The grid is kept as one string per row ({@code #} marks a block cell, letters are the
 * solutions). Clues only carry their prompt; numbering, lengths and answers are derived from the
 * grid when the puzzle is turned into a {@code PuzzleModel}.
 */
@Entity
@Table(name = "puzzles")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Puzzle extends BaseEntity {

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 200)
    private String author;

    @Column(nullable = false)
    private int width;

    @Column(nullable = false)
    private int height;

    /**
     * SHA-256 over grid and clue positions, used to detect re-imports of the same puzzle.
     */
    @Column(name = "content_hash", nullable = false, unique = true, length = 64)
    private String contentHash;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "puzzle_rows", joinColumns = @JoinColumn(name = "puzzle_id"))
    @OrderColumn(name = "row_index")
    @Column(name = "grid_row", nullable = false, length = 100)
    private List<String> gridRows = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "puzzle_clues", joinColumns = @JoinColumn(name = "puzzle_id"))
    @OrderColumn(name = "clue_index")
    private List<ClueEntry> clues = new ArrayList<>();

    public Puzzle(String title, String author, List<String> gridRows, List<ClueEntry> clues, String contentHash) {
        this.title = title;
        this.author = author;
        this.gridRows = new ArrayList<>(gridRows);
        this.clues = new ArrayList<>(clues);
        this.height = gridRows.size();
        this.width = gridRows.isEmpty() ? 0 : gridRows.get(0).length();
        this.contentHash = contentHash;
    }

    /**
     * Replaces the clue prompts, keeping grid and hash.
     */
    public void replaceClues(List<ClueEntry> newClues) {
        this.clues.clear();
        this.clues.addAll(newClues);
    }
}
