package com.nicolaswinsten.gamification.web;

import java.util.List;

import com.nicolaswinsten.gamification.demo.DemoAction;
import com.nicolaswinsten.gamification.demo.DemoBadge;
import com.nicolaswinsten.gamification.demo.DemoDataset;
import com.nicolaswinsten.gamification.demo.DemoLeaderboardEntry;
import com.nicolaswinsten.gamification.demo.DemoUser;
import com.nicolaswinsten.gamification.demo.DemoUserSummary;
import com.nicolaswinsten.gamification.demo.UserNotFoundException;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only demo endpoints under {@code /api/demo}.
 *
 * <p>Every handler is a lookup against {@link DemoDataset}; nothing here writes. The award
 * endpoint accepts a well-formed action and answers with a notice that no data changed.
 *
 * <table>
 *   <tr><th>Method</th><th>Path</th><th>Response</th></tr>
 *   <tr><td>GET</td><td>{@code /leaderboard}</td><td>leaderboard rows, rank order</td></tr>
 *   <tr><td>GET</td><td>{@code /badges}</td><td>all badges</td></tr>
 *   <tr><td>GET</td><td>{@code /users}</td><td>all users</td></tr>
 *   <tr><td>GET</td><td>{@code /user/{user_id}}</td><td>user summary, or 404</td></tr>
 *   <tr><td>POST</td><td>{@code /award}</td><td>demo-mode acknowledgement</td></tr>
 * </table>
 */
@RestController
@RequestMapping("/api/demo")
public class DemoController {
    private static final Logger LOGGER = LoggerFactory.getLogger(DemoController.class);

    static final String MODE = "demo";
    static final String READ_ONLY_NOTICE = "Read-only demo: no data was changed.";

    private final DemoDataset dataset;

    public DemoController(DemoDataset dataset) {
        this.dataset = dataset;
    }

    @GetMapping("/leaderboard")
    public List<DemoLeaderboardEntry> leaderboard() {
        return dataset.leaderboard();
    }

    @GetMapping("/badges")
    public List<DemoBadge> badges() {
        return dataset.badges();
    }

    @GetMapping("/users")
    public List<DemoUser> users() {
        return dataset.users();
    }

    /**
     * @throws UserNotFoundException if {@code userId} is not in the dataset (mapped to 404)
     */
    @GetMapping("/user/{user_id}")
    public DemoUserSummary userSummary(@PathVariable("user_id") String userId) {
        LOGGER.debug("Summary requested: userId={}", userId);
        return dataset.findSummary(userId).orElseThrow(() -> new UserNotFoundException(userId));
    }

    /** Acknowledges the action without touching the dataset. */
    @PostMapping("/award")
    public AwardReceipt award(@Valid @RequestBody DemoAction action) {
        LOGGER.info("Award ignored in demo mode: action={}, points={}", action.action(), action.points());
        return new AwardReceipt(MODE, READ_ONLY_NOTICE);
    }

    public record AwardReceipt(String mode, String message) {}
}
