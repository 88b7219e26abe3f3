package com.leaderboard.competition.service.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Known teams by id. When restricted, records tagged with a team outside the directory
 * do not count towards any team.
 */
public class TeamDirectory {

    private final Map<String, String> namesById;
    private final boolean restrictToKnownTeams;

    public TeamDirectory(Map<String, String> namesById, boolean restrictToKnownTeams) {
        this.namesById = namesById == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(namesById));
        this.restrictToKnownTeams = restrictToKnownTeams;
    }

    public static TeamDirectory open() {
        return new TeamDirectory(Collections.emptyMap(), false);
    }

    public boolean accepts(String teamId) {
        return !restrictToKnownTeams || namesById.containsKey(teamId);
    }

    public Optional<String> nameOf(String teamId) {
        return Optional.ofNullable(namesById.get(teamId));
    }

    public String displayName(String teamId) {
        return nameOf(teamId).orElse(teamId);
    }
}
