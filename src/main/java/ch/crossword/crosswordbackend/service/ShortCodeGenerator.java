package ch.crossword.crosswordbackend.service;

import ch.crossword.crosswordbackend.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates room codes that are easy to read aloud and type: six characters without the
 * look-alikes {@code I}, {@code O}, {@code 0} and {@code 1}.
 */
@Component
@RequiredArgsConstructor
public class ShortCodeGenerator {

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int LENGTH = 6;

    private final GameRepository gameRepository;

    public String nextUniqueCode() {
        String code;
        do {
            code = randomCode();
        } while (gameRepository.existsByShortCode(code));
        return code;
    }

    static String randomCode() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
