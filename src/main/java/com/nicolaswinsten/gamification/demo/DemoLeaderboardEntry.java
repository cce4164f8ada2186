package com.nicolaswinsten.gamification.demo;

/** One leaderboard row. Ranks start at 1 and follow descending points. */
public record DemoLeaderboardEntry(DemoUser user, int points, int level, int rank) {}
