package com.puzzletracker.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Streak counters stored on a record. {@code winstreak <= maxWinstreak} always holds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreakState {
    private int playstreak;
    private int winstreak;
    private int maxWinstreak;
}
