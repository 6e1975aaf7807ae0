package com.puzzletracker.ingestion.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A new record, either as share text or as manually entered scores.
 * When {@code shareText} is present it wins over {@code failed} and {@code scores}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRecordRequest {

    @NotBlank
    private String gameId;

    private String shareText;

    private Boolean failed;

    private Map<String, Map<String, Object>> scores;

    @Size(max = 500)
    private String notes;

    private String timeZone; // IANA zone id, server default when absent

    private String playedAt; // ISO timestamp or yyyy-MM-dd, now when absent
}
