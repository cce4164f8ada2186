package com.nicolaswinsten.gamification.demo;

/**
 * A player shown on the leaderboard.
 *
 * @param avatar optional avatar reference, {@code null} when the player has none
 * @param title  display title, {@code "Player"} unless given
 */
public record DemoUser(String id, String name, String avatar, String title) {

    public static final String DEFAULT_TITLE = "Player";

    public DemoUser {
        if (title == null) {
            title = DEFAULT_TITLE;
        }
    }

    public DemoUser(String id, String name) {
        this(id, name, null, DEFAULT_TITLE);
    }
}
