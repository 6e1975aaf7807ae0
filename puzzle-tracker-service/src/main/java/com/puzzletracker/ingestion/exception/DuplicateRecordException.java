package com.puzzletracker.ingestion.exception;

import java.time.LocalDate;

/**
 * A record already exists for this owner, game and puzzle day.
 */
public class DuplicateRecordException extends RuntimeException {

    private final String gameId;
    private final LocalDate puzzleDay;

    public DuplicateRecordException(String gameId, LocalDate puzzleDay) {
        super("Already recorded " + gameId + " for puzzle day " + puzzleDay);
        this.gameId = gameId;
        this.puzzleDay = puzzleDay;
    }

    public String getGameId() {
        return gameId;
    }

    public LocalDate getPuzzleDay() {
        return puzzleDay;
    }
}
