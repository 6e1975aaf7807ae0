package com.puzzletracker.ingestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResetInfoResponse {
    private String gameId;
    private String resetTime;
    private String zone; // frame the reset is evaluated in
    private Instant lastReset;
    private Instant nextReset;
    private long hoursUntilReset;
    private long minutesUntilReset;
    private String timeUntilReset; // "H:MM"
    private LocalDate currentPuzzleDay;
}
