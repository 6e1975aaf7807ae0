package com.puzzletracker.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * A tracked puzzle game and its daily reset configuration
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Game {

    private static final DateTimeFormatter RESET_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    private String gameId;
    private String displayName;
    private String url;
    private String resetTime; // "HH:MM", 24-hour
    private boolean asynchronous; // true: reset in the player's local time, false: in UTC
    private Map<String, Map<String, Integer>> scoreTypes; // -1 means no maximum

    /**
     * Parse the reset time. A game with an unreadable reset time is misconfigured and
     * must not be used for puzzle-day arithmetic.
     *
     * @throws IllegalArgumentException if {@code resetTime} is missing or not "HH:MM"
     */
    public LocalTime resetLocalTime() {
        if (resetTime == null) {
            throw new IllegalArgumentException("Game " + gameId + " has no reset time");
        }
        try {
            return LocalTime.parse(resetTime.trim(), RESET_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Game " + gameId + " has an invalid reset time '" + resetTime + "', expected HH:MM", e);
        }
    }
}
