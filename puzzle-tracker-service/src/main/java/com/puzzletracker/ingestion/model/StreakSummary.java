package com.puzzletracker.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Streaks as shown to the player right now. Not persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreakSummary {
    private int playstreak;
    private int winstreak;
    private int maxWinstreak;
    private boolean streakAtRisk; // last played yesterday, must play today to keep the streak
    private LocalDate lastPlayedDay;
}
