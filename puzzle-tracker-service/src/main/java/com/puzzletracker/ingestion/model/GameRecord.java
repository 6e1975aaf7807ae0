package com.puzzletracker.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * One attempt at one game, keyed by owner, game and the puzzle day it belongs to.
 * Streak fields in {@link RecordMetadata} are written once, when the record is created.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameRecord {
    private String recordId;
    private String ownerId;
    private String gameId;
    private LocalDate puzzleDay;
    private Instant createdAt; // full instant: the puzzle day depends on the reset time
    private Instant updatedAt;
    private Map<String, Map<String, Object>> scores;
    private boolean failed;
    private RecordMetadata metadata;
}
