package ch.crossword;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the crossword backend.
 *
 * <p>Scheduling is enabled for the presence checks that run after a player disconnects.
 */
@SpringBootApplication
@EnableScheduling
public class CrosswordBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrosswordBackendApplication.class, args);
    }

}
