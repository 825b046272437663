package ch.crossword.crosswordbackend.service;

import ch.crossword.crosswordbackend.repository.GameRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShortCodeGeneratorTest {

    @Mock
    private GameRepository gameRepository;

    @InjectMocks
    private ShortCodeGenerator generator;

    @Test
    void randomCode_shouldUseUnambiguousAlphabetOnly() {
        for (int i = 0; i < 200; i++) {
            String code = ShortCodeGenerator.randomCode();
            assertThat(code).hasSize(ShortCodeGenerator.LENGTH);
            assertThat(code).doesNotContain("I", "O", "0", "1");
            assertThat(code.chars()).allMatch(c -> ShortCodeGenerator.ALPHABET.indexOf(c) >= 0);
        }
    }

    @Test
    void nextUniqueCode_shouldRetryWhileCodeIsTaken() {
        when(gameRepository.existsByShortCode(anyString())).thenReturn(true, true, false);

        String code = generator.nextUniqueCode();

        assertThat(code).hasSize(6);
        verify(gameRepository, times(3)).existsByShortCode(anyString());
    }

    @Test
    void colorFor_shouldWrapAroundPool() {
        assertThat(PlayerColors.colorFor(0)).isEqualTo(PlayerColors.POOL.get(0));
        assertThat(PlayerColors.colorFor(PlayerColors.POOL.size())).isEqualTo(PlayerColors.POOL.get(0));
        assertThat(PlayerColors.colorFor(9)).isEqualTo(PlayerColors.POOL.get(1));
    }
}
