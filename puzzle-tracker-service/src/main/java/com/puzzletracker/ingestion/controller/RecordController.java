package com.puzzletracker.ingestion.controller;

import com.puzzletracker.ingestion.dto.IngestRecordRequest;
import com.puzzletracker.ingestion.dto.ShareTextRequest;
import com.puzzletracker.ingestion.model.GameRecord;
import com.puzzletracker.ingestion.model.StreakSummary;
import com.puzzletracker.ingestion.service.RecordIngestionService;
import com.puzzletracker.parser.ParsedResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/records")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class RecordController {

    static final String OWNER_HEADER = "X-Owner-Id";

    private final RecordIngestionService ingestionService;

    public RecordController(RecordIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    /**
     * POST /api/records/parse
     * Parse share text without saving it
     */
    @PostMapping("/parse")
    public ResponseEntity<ParsedResult> parse(@RequestBody ShareTextRequest request) {
        return ResponseEntity.ok(ingestionService.preview(request));
    }

    /**
     * POST /api/records
     * Save a record for the current puzzle day
     */
    @PostMapping
    public ResponseEntity<GameRecord> create(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @Valid @RequestBody IngestRecordRequest request) {

        GameRecord record = ingestionService.ingest(ownerId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    /**
     * GET /api/records/{gameId}
     * Owner's records for a game, newest first
     */
    @GetMapping("/{gameId}")
    public ResponseEntity<List<GameRecord>> list(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @PathVariable String gameId) {

        return ResponseEntity.ok(ingestionService.getRecords(ownerId, gameId));
    }

    /**
     * GET /api/records/{gameId}/streak
     * Streaks as they stand now
     */
    @GetMapping("/{gameId}/streak")
    public ResponseEntity<StreakSummary> streak(
            @RequestHeader(OWNER_HEADER) String ownerId,
            @PathVariable String gameId,
            @RequestParam(required = false) String zone) {

        return ResponseEntity.ok(ingestionService.getStreakSummary(ownerId, gameId, zone));
    }
}
