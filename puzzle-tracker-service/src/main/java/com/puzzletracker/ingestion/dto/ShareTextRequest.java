package com.puzzletracker.ingestion.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShareTextRequest {
    private String text;
    private String gameId; // optional: detect the game when absent
}
