package ch.crossword.crosswordbackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API metadata shown in Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    /**
     * Describes the REST surface for the generated API docs.
     *
     * @return {@link OpenAPI} model carrying the title, summary and version of the API
     */
    @Bean
    public OpenAPI crosswordOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Crossword Game API")
                        .description("Puzzle store, solo and multiplayer crossword games with atomic cell claims")
                        .version("v1.0.0"));
    }
}
