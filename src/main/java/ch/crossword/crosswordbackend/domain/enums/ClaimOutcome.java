package ch.crossword.crosswordbackend.domain.enums;

/**
 * Result of a cell claim.
 */
public enum ClaimOutcome {
    /**
     * The claim was accepted and persisted. The caller now owns the cell.
     */
    GRANTED,

    /**
     * The arbiter refused the claim (cell already taken, game not active, or letter not correct).
     */
    DENIED,

    /**
     * The arbiter could not be reached. Clients recover exactly as for {@link #DENIED}.
     */
    UNREACHABLE;

    public boolean isGranted() {
        return this == GRANTED;
    }
}
