package com.puzzletracker.ingestion.controller;

import com.puzzletracker.ingestion.dto.ResetInfoResponse;
import com.puzzletracker.ingestion.model.Game;
import com.puzzletracker.ingestion.repository.GameCatalog;
import com.puzzletracker.ingestion.service.RecordIngestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/games")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class GameController {

    private final GameCatalog catalog;
    private final RecordIngestionService ingestionService;

    public GameController(GameCatalog catalog, RecordIngestionService ingestionService) {
        this.catalog = catalog;
        this.ingestionService = ingestionService;
    }

    /**
     * GET /api/games
     */
    @GetMapping
    public ResponseEntity<List<Game>> list() {
        return ResponseEntity.ok(new ArrayList<>(catalog.all()));
    }

    /**
     * GET /api/games/{gameId}/reset
     * Last and next reset, and time left in the current puzzle
     */
    @GetMapping("/{gameId}/reset")
    public ResponseEntity<ResetInfoResponse> reset(
            @PathVariable String gameId,
            @RequestParam(required = false) String zone) {

        return ResponseEntity.ok(ingestionService.getResetInfo(gameId, zone));
    }
}
