package com.puzzletracker.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordMetadata {
    private String puzzleNumber;
    private String grid;
    private String shareText;
    private Integer maxAttempts;
    private Integer playstreak;
    private Integer winstreak;
    private Integer maxWinstreak;
    private Boolean hasInvalidShareText;
    private String notes;
}
