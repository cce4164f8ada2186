package com.nicolaswinsten.gamification.demo;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The fixed, read-only sample records served by the demo endpoints.
 *
 * <h3>State model</h3>
 * Users, badges, leaderboard rows and per-user summaries are built once when the bean is
 * created and are never modified afterwards; every collection handed out is unmodifiable,
 * so the dataset is shared freely between request threads without locking.
 * Nothing is persisted; a restart rebuilds the same records.
 *
 * <h3>Integrity</h3>
 * The constructor checks the relationships the endpoints rely on and refuses to start on a
 * broken dataset:
 * <ul>
 *   <li>user and badge ids are unique,</li>
 *   <li>leaderboard ranks run {@code 1..n} in list order with strictly decreasing points,</li>
 *   <li>every leaderboard row and summary points at a known user,</li>
 *   <li>every summary is keyed by its own user's id and only holds known badges.</li>
 * </ul>
 */
@Component
public class DemoDataset {
    private static final Logger LOGGER = LoggerFactory.getLogger(DemoDataset.class);

    private final List<DemoUser> users;
    private final List<DemoBadge> badges;
    private final List<DemoLeaderboardEntry> leaderboard;
    /** User id → summary, in insertion order. */
    private final Map<String, DemoUserSummary> summaries;

    public DemoDataset() {
        this(SampleData.USERS, SampleData.BADGES, SampleData.LEADERBOARD, SampleData.SUMMARIES);
        LOGGER.info("Demo dataset loaded: users={}, badges={}, leaderboard={}, summaries={}",
            users.size(), badges.size(), leaderboard.size(), summaries.size());
    }

    DemoDataset(
            List<DemoUser> users,
            List<DemoBadge> badges,
            List<DemoLeaderboardEntry> leaderboard,
            Map<String, DemoUserSummary> summaries) {
        this.users = List.copyOf(users);
        this.badges = List.copyOf(badges);
        this.leaderboard = List.copyOf(leaderboard);
        this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
        verify();
    }

    public List<DemoUser> users() {
        return users;
    }

    public List<DemoBadge> badges() {
        return badges;
    }

    /** Leaderboard rows in rank order, exactly as constructed. */
    public List<DemoLeaderboardEntry> leaderboard() {
        return leaderboard;
    }

    public Optional<DemoUserSummary> findSummary(String userId) {
        return userId == null ? Optional.empty() : Optional.ofNullable(summaries.get(userId));
    }

    private void verify() {
        Set<String> userIds = new HashSet<>();
        for (DemoUser user : users) {
            if (!userIds.add(user.id())) {
                throw new IllegalStateException("Duplicate user id: " + user.id());
            }
        }
        Set<String> badgeIds = new HashSet<>();
        for (DemoBadge badge : badges) {
            if (!badgeIds.add(badge.id())) {
                throw new IllegalStateException("Duplicate badge id: " + badge.id());
            }
        }

        int expectedRank = 1;
        DemoLeaderboardEntry previous = null;
        for (DemoLeaderboardEntry entry : leaderboard) {
            if (!users.contains(entry.user())) {
                throw new IllegalStateException("Leaderboard refers to unknown user: " + entry.user().id());
            }
            if (entry.points() < 0 || entry.level() < 1) {
                throw new IllegalStateException("Leaderboard entry out of range for user " + entry.user().id()
                    + ": points=" + entry.points() + ", level=" + entry.level());
            }
            if (entry.rank() != expectedRank) {
                throw new IllegalStateException("Expected rank " + expectedRank + " but found " + entry.rank()
                    + " for user " + entry.user().id());
            }
            if (previous != null && entry.points() >= previous.points()) {
                throw new IllegalStateException("Points must decrease with rank: rank " + previous.rank()
                    + " has " + previous.points() + ", rank " + entry.rank() + " has " + entry.points());
            }
            previous = entry;
            expectedRank++;
        }

        for (Map.Entry<String, DemoUserSummary> entry : summaries.entrySet()) {
            DemoUserSummary summary = entry.getValue();
            if (!users.contains(summary.user())) {
                throw new IllegalStateException("Summary refers to unknown user: " + summary.user().id());
            }
            if (!entry.getKey().equals(summary.user().id())) {
                throw new IllegalStateException("Summary keyed as " + entry.getKey()
                    + " belongs to user " + summary.user().id());
            }
            for (DemoBadge badge : summary.badges()) {
                if (!badges.contains(badge)) {
                    throw new IllegalStateException("Summary for " + entry.getKey()
                        + " refers to unknown badge: " + badge.id());
                }
            }
        }
    }

    // ── Sample records ───────────────────────────────────────────────────────

    private static final class SampleData {
        static final List<DemoUser> USERS = List.of(
            new DemoUser("u_001", "Alex Morgan", null, "Sales Captain"),
            new DemoUser("u_002", "Jamie Lee", null, "Ops Strategist"),
            new DemoUser("u_003", "Riley Chen", null, "Product Ace"),
            new DemoUser("u_004", "Jordan Patel", null, "CX Pro")
        );

        static final List<DemoBadge> BADGES = List.of(
            new DemoBadge("b_hero", "Hero", "Top performer of the week", "Trophy", "#F59E0B"),
            new DemoBadge("b_streak", "Streak", "7-day activity streak", "Flame", "#EF4444"),
            new DemoBadge("b_helper", "Mentor", "Helped 5 teammates", "Handshake", "#10B981")
        );

        static final List<DemoLeaderboardEntry> LEADERBOARD = List.of(
            new DemoLeaderboardEntry(USERS.get(0), 18250, 12, 1),
            new DemoLeaderboardEntry(USERS.get(1), 16940, 11, 2),
            new DemoLeaderboardEntry(USERS.get(2), 15100, 10, 3),
            new DemoLeaderboardEntry(USERS.get(3), 13320, 9, 4)
        );

        static final Map<String, DemoUserSummary> SUMMARIES = summaries();

        private static Map<String, DemoUserSummary> summaries() {
            Map<String, DemoUserSummary> map = new LinkedHashMap<>();
            map.put("u_001", new DemoUserSummary(USERS.get(0), 18250, 12, 8,
                List.of(BADGES.get(0), BADGES.get(1)),
                List.of(
                    "Closed enterprise deal (+2,000)",
                    "Completed onboarding quest (+300)",
                    "Shared playbook with team (+100)")));
            map.put("u_002", new DemoUserSummary(USERS.get(1), 16940, 11, 6,
                List.of(BADGES.get(1)),
                List.of(
                    "Optimized ops workflow (+500)",
                    "Daily check-in (+20)")));
            map.put("u_003", new DemoUserSummary(USERS.get(2), 15100, 10, 4,
                List.of(),
                List.of("Launched feature beta (+1,200)")));
            map.put("u_004", new DemoUserSummary(USERS.get(3), 13320, 9, 2,
                List.of(BADGES.get(2)),
                List.of("Resolved 20+ support tickets (+800)")));
            return map;
        }

        private SampleData() {}
    }
}
