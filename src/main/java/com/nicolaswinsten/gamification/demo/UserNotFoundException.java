package com.nicolaswinsten.gamification.demo;

/** Thrown when a summary is requested for an id that is not part of the demo dataset. */
public class UserNotFoundException extends RuntimeException {

    public static final String MESSAGE = "User not found in demo dataset";

    private final String userId;

    public UserNotFoundException(String userId) {
        super(MESSAGE);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
