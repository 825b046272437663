package ch.crossword.crosswordbackend.service;

import java.util.List;

/**
 * Fixed color pool for players, assigned by join order.
 */
public final class PlayerColors {

    public static final List<String> POOL = List.of(
            "#3b82f6", // blue
            "#ef4444", // red
            "#22c55e", // green
            "#f59e0b", // amber
            "#8b5cf6", // violet
            "#ec4899", // pink
            "#06b6d4", // cyan
            "#f97316"  // orange
    );

    private PlayerColors() {
    }

    /**
     * @param index 0-based join index; wraps around after the pool is exhausted
     */
    public static String colorFor(int index) {
        return POOL.get(Math.floorMod(index, POOL.size()));
    }
}
