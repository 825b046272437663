package ch.crossword.crosswordbackend.domain.puzzle;

import ch.crossword.crosswordbackend.domain.enums.Direction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Word-level progress over a fill state.
 *
 * <p>The fill state is passed as a predicate telling whether a cell holds a correct letter, so the
 * same logic serves the client's fill map and the persisted game cells.
 */
public final class ClueProgress {

    private ClueProgress() {
        // utility class
    }

    /**
     * @return clues whose cells are all correctly filled, in puzzle order
     */
    public static List<Clue> completedClues(PuzzleModel puzzle, Predicate<CellCoord> isCorrect) {
        List<Clue> completed = new ArrayList<>();
        for (Clue clue : puzzle.clues()) {
            List<CellCoord> cells = GridTopology.wordCells(puzzle, clue.row(), clue.col(), clue.direction());
            if (!cells.isEmpty() && cells.stream().allMatch(isCorrect)) {
                completed.add(clue);
            }
        }
        return completed;
    }

    /**
     * Returns the clues that filling {@code (row, col)} would complete: every other cell of the
     * word is already correct. Evaluated before the cell itself is written.
     *
     * @return zero, one (across or down) or two clues
     */
    public static List<Clue> newlyCompletedClues(PuzzleModel puzzle, Predicate<CellCoord> isCorrect, int row, int col) {
        List<Clue> completed = new ArrayList<>();
        CellCoord target = new CellCoord(row, col);

        for (Direction direction : Direction.values()) {
            List<CellCoord> word = GridTopology.wordCells(puzzle, row, col, direction);
            if (word.size() < 2) continue;

            Clue clue = GridTopology.clueForCell(puzzle, row, col, direction);
            if (clue == null) continue;

            boolean othersCorrect = word.stream()
                    .allMatch(c -> c.equals(target) || isCorrect.test(c));
            if (othersCorrect) {
                completed.add(clue);
            }
        }
        return completed;
    }

    /**
     * Counts completed words per player.
     *
     * @param creditedPlayers one entry per completed word: the player credited with it
     * @return number of words per player, in order of first appearance
     */
    public static Map<UUID, Integer> countCluesPerPlayer(Collection<UUID> creditedPlayers) {
        Map<UUID, Integer> counts = new LinkedHashMap<>();
        for (UUID playerId : creditedPlayers) {
            if (playerId != null) {
                counts.merge(playerId, 1, Integer::sum);
            }
        }
        return counts;
    }
}
