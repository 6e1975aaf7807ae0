package com.puzzletracker.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResetCountdown {
    private long hours;
    private long minutes;

    /**
     * "H:MM", e.g. "5:07"
     */
    public String format() {
        return String.format("%d:%02d", hours, minutes);
    }
}
