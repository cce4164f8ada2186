package com.nicolaswinsten.gamification.demo;

/**
 * An achievement badge.
 *
 * @param icon  icon name understood by the frontend
 * @param color hex colour string, e.g. {@code #F59E0B}
 */
public record DemoBadge(String id, String name, String description, String icon, String color) {

    public static final String DEFAULT_ICON = "Star";
    /** indigo-500 */
    public static final String DEFAULT_COLOR = "#6366F1";

    public DemoBadge {
        if (icon == null) {
            icon = DEFAULT_ICON;
        }
        if (color == null) {
            color = DEFAULT_COLOR;
        }
    }
}
