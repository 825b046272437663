package ch.crossword.crosswordbackend.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-game settings chosen by the host when the game is created.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class GameSettings {

    /**
     * Allowed values for {@link #wrongAnswerTimeoutSeconds}.
     */
    public static final List<Integer> TIMEOUT_OPTIONS = List.of(0, 1, 2, 3, 5);

    /**
     * Seconds a player is locked out of typing after a wrong letter. {@code 0} disables the lockout.
     */
    @Column(name = "wrong_answer_timeout_seconds", nullable = false)
    private int wrongAnswerTimeoutSeconds;

    private GameSettings(int wrongAnswerTimeoutSeconds) {
        this.wrongAnswerTimeoutSeconds = wrongAnswerTimeoutSeconds;
    }

    public static GameSettings defaultSettings() {
        return new GameSettings(0);
    }

    /**
     * @throws IllegalArgumentException if the timeout is not one of {@link #TIMEOUT_OPTIONS}
     */
    public static GameSettings of(int wrongAnswerTimeoutSeconds) {
        if (!TIMEOUT_OPTIONS.contains(wrongAnswerTimeoutSeconds)) {
            throw new IllegalArgumentException("Unsupported wrong answer timeout: " + wrongAnswerTimeoutSeconds);
        }
        return new GameSettings(wrongAnswerTimeoutSeconds);
    }
}
