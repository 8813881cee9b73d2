package ch.battleship.matchserver.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the OpenAPI / Swagger documentation.
 *
 * <p>Only the REST side (health and status) is described here; the game itself is played over the
 * WebSocket endpoint.
 */
@Configuration
public class OpenApiConfig {

    /**
     * Creates the OpenAPI definition used by Swagger UI.
     *
     * @return configured {@link OpenAPI} instance with API metadata
     */
    @Bean
    public OpenAPI matchServerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Battleship Match Server API")
                        .description("Operational endpoints of the Battleship WebSocket match server")
                        .version("v1.0.0"));
    }
}
