package com.puzzletracker.parser;

/**
 * Raised when a share text does not match the grammar of the game it was submitted for.
 * Carries an example of the expected format so the user can correct their input.
 */
public class ShareTextParseException extends RuntimeException {

    private final String gameName;
    private final String expectedFormat;

    public ShareTextParseException(String message) {
        this(message, null, null);
    }

    public ShareTextParseException(String message, String gameName, String expectedFormat) {
        super(message);
        this.gameName = gameName;
        this.expectedFormat = expectedFormat;
    }

    public static ShareTextParseException forGame(String gameName, String expectedFormat) {
        return new ShareTextParseException(
                String.format("Incorrect share text for %s. Expected format: \"%s\"", gameName, expectedFormat),
                gameName, expectedFormat);
    }

    public static ShareTextParseException forGame(String gameName, String expectedFormat, String detail) {
        return new ShareTextParseException(
                String.format("Incorrect share text for %s. %s", gameName, detail),
                gameName, expectedFormat);
    }

    public String getGameName() {
        return gameName;
    }

    public String getExpectedFormat() {
        return expectedFormat;
    }
}
