package com.leaderboard.competition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CompetitionLeaderboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompetitionLeaderboardApplication.class, args);
    }
}
