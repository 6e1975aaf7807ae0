package com.puzzletracker.ingestion.exception;

public class UnknownGameException extends RuntimeException {

    private final String gameId;

    public UnknownGameException(String gameId) {
        super("Unknown game: " + gameId);
        this.gameId = gameId;
    }

    public String getGameId() {
        return gameId;
    }
}
