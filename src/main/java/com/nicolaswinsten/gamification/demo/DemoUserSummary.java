package com.nicolaswinsten.gamification.demo;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Profile card for a single player: standing, streak, earned badges and a short activity feed.
 *
 * @param recentActions free-text activity lines, newest first
 */
public record DemoUserSummary(
    DemoUser user,
    int points,
    int level,
    @JsonProperty("streak_days") int streakDays,
    List<DemoBadge> badges,
    @JsonProperty("recent_actions") List<String> recentActions
) {

    public DemoUserSummary {
        badges = badges == null ? List.of() : List.copyOf(badges);
        recentActions = recentActions == null ? List.of() : List.copyOf(recentActions);
    }
}
