package com.nicolaswinsten.gamification.web;

import com.nicolaswinsten.gamification.demo.DemoAction;
import com.nicolaswinsten.gamification.demo.DemoDataset;
import com.nicolaswinsten.gamification.demo.DemoLeaderboardEntry;
import com.nicolaswinsten.gamification.demo.DemoUser;
import com.nicolaswinsten.gamification.demo.DemoUserSummary;
import com.nicolaswinsten.gamification.demo.UserNotFoundException;
import com.nicolaswinsten.gamification.web.DemoController.AwardReceipt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DemoControllerTest {

    DemoController controller;

    @BeforeEach
    void setUp() {
        controller = new DemoController(new DemoDataset());
    }

    // ── userSummary() ───────────────────────────────────────────────────────

    @Test
    void summaryUserMatchesListedUser() {
        for (DemoUser user : controller.users()) {
            DemoUserSummary summary = controller.userSummary(user.id());
            assertThat(summary.user()).isEqualTo(user);
        }
    }

    @Test
    void unknownUserThrowsNotFound() {
        assertThatThrownBy(() -> controller.userSummary("u_999"))
            .isInstanceOf(UserNotFoundException.class)
            .hasMessage("User not found in demo dataset");
    }

    // ── award() ─────────────────────────────────────────────────────────────

    @Test
    void awardAcknowledgesWithoutChangingData() {
        List<DemoUser> usersBefore = List.copyOf(controller.users());
        List<DemoLeaderboardEntry> leaderboardBefore = List.copyOf(controller.leaderboard());

        AwardReceipt receipt = controller.award(new DemoAction("test", 50));

        assertThat(receipt.mode()).isEqualTo("demo");
        assertThat(receipt.message()).isEqualTo("Read-only demo: no data was changed.");
        assertThat(controller.users()).isEqualTo(usersBefore);
        assertThat(controller.leaderboard()).isEqualTo(leaderboardBefore);
    }

    @Test
    void awardAcceptsNegativePoints() {
        assertThat(controller.award(new DemoAction("penalty", -1_000_000)).mode()).isEqualTo("demo");
    }

    // ── listings ────────────────────────────────────────────────────────────

    @Test
    void listingsAreStableAcrossCalls() {
        assertThat(controller.leaderboard()).isEqualTo(controller.leaderboard());
        assertThat(controller.badges()).hasSize(3);
        assertThat(controller.users()).hasSize(4);
    }
}
