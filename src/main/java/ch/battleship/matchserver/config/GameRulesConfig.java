package ch.battleship.matchserver.config;

import ch.battleship.matchserver.domain.GameConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GameRulesConfig {

    @Bean
    public GameConfiguration gameConfiguration() {
        return GameConfiguration.defaultConfig();
    }
}
