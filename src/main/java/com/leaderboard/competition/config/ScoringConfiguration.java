package com.leaderboard.competition.config;

import com.leaderboard.competition.service.scoring.TeamDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ScoringProperties.class)
public class ScoringConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ScoringConfiguration.class);

    @Bean
    public TeamDirectory teamDirectory(ScoringProperties properties) {
        logger.info("Team directory loaded with {} teams (restricted: {})",
            properties.getTeams().size(), properties.isRestrictToKnownTeams());
        return new TeamDirectory(properties.getTeams(), properties.isRestrictToKnownTeams());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
