package com.puzzletracker.ingestion.controller;

import com.puzzletracker.ingestion.dto.IngestRecordRequest;
import com.puzzletracker.ingestion.dto.ResetInfoResponse;
import com.puzzletracker.ingestion.dto.ShareTextRequest;
import com.puzzletracker.ingestion.exception.DuplicateRecordException;
import com.puzzletracker.ingestion.exception.UnknownGameException;
import com.puzzletracker.ingestion.model.Game;
import com.puzzletracker.ingestion.model.GameRecord;
import com.puzzletracker.ingestion.model.RecordMetadata;
import com.puzzletracker.ingestion.model.StreakSummary;
import com.puzzletracker.ingestion.repository.GameCatalog;
import com.puzzletracker.ingestion.service.RecordIngestionService;
import com.puzzletracker.parser.ParsedResult;
import com.puzzletracker.parser.ShareTextParseException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {RecordController.class, GameController.class})
class RecordControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecordIngestionService ingestionService;

    @MockBean
    private GameCatalog catalog;

    @Test
    void testCreateRecord() throws Exception {
        GameRecord record = GameRecord.builder()
                .recordId("r-1")
                .ownerId("alice")
                .gameId("wordle")
                .puzzleDay(LocalDate.of(2024, 1, 16))
                .createdAt(Instant.parse("2024-01-16T12:00:00Z"))
                .scores(Map.of("puzzle1", Map.of("attempts", 4)))
                .metadata(RecordMetadata.builder().playstreak(3).winstreak(2).maxWinstreak(5).build())
                .build();
        when(ingestionService.ingest(eq("alice"), any(IngestRecordRequest.class))).thenReturn(record);

        mockMvc.perform(post("/api/records")
                        .header("X-Owner-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gameId\":\"wordle\",\"shareText\":\"Wordle 1,643 4/6\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.recordId").value("r-1"))
                .andExpect(jsonPath("$.puzzleDay").value("2024-01-16"))
                .andExpect(jsonPath("$.scores.puzzle1.attempts").value(4))
                .andExpect(jsonPath("$.metadata.winstreak").value(2))
                .andExpect(jsonPath("$.metadata.grid").doesNotExist());
    }

    @Test
    void testCreateRequiresGameId() throws Exception {
        mockMvc.perform(post("/api/records")
                        .header("X-Owner-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shareText\":\"Wordle 1,643 4/6\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.errors[0].field").value("gameId"));

        verify(ingestionService, never()).ingest(any(), any());
    }

    @Test
    void testCreateRequiresOwner() throws Exception {
        mockMvc.perform(post("/api/records")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gameId\":\"wordle\",\"shareText\":\"Wordle 1,643 4/6\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testDuplicateIsConflict() throws Exception {
        when(ingestionService.ingest(eq("alice"), any(IngestRecordRequest.class)))
                .thenThrow(new DuplicateRecordException("wordle", LocalDate.of(2024, 1, 16)));

        mockMvc.perform(post("/api/records")
                        .header("X-Owner-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gameId\":\"wordle\",\"shareText\":\"Wordle 1,643 4/6\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409))
                .andExpect(jsonPath("$.details.puzzleDay").value("2024-01-16"));
    }

    @Test
    void testParseErrorCarriesExpectedFormat() throws Exception {
        when(ingestionService.preview(any(ShareTextRequest.class)))
                .thenThrow(ShareTextParseException.forGame("Wordle", "Wordle 1,643 X/6"));

        mockMvc.perform(post("/api/records/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Bandle #1227 4/6\",\"gameId\":\"wordle\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.expectedFormat").value("Wordle 1,643 X/6"))
                .andExpect(jsonPath("$.details.gameName").value("Wordle"));
    }

    @Test
    void testPreview() throws Exception {
        ParsedResult result = new ParsedResult("Wordle");
        result.putScore("attempts", 4);
        result.setPuzzleNumber("1,643");
        when(ingestionService.preview(any(ShareTextRequest.class))).thenReturn(result);

        mockMvc.perform(post("/api/records/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Wordle 1,643 4/6\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gameName").value("Wordle"))
                .andExpect(jsonPath("$.scores.puzzle1.attempts").value(4))
                .andExpect(jsonPath("$.parseWarnings").doesNotExist());
    }

    @Test
    void testStreakSummary() throws Exception {
        when(ingestionService.getStreakSummary("alice", "wordle", "Europe/Paris"))
                .thenReturn(StreakSummary.builder().playstreak(4).winstreak(3).maxWinstreak(6)
                        .streakAtRisk(true).lastPlayedDay(LocalDate.of(2024, 1, 15)).build());

        mockMvc.perform(get("/api/records/wordle/streak")
                        .header("X-Owner-Id", "alice")
                        .param("zone", "Europe/Paris"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.playstreak").value(4))
                .andExpect(jsonPath("$.streakAtRisk").value(true))
                .andExpect(jsonPath("$.lastPlayedDay").value("2024-01-15"));
    }

    @Test
    void testUnknownGameIsNotFound() throws Exception {
        when(ingestionService.getRecords("alice", "nope")).thenThrow(new UnknownGameException("nope"));

        mockMvc.perform(get("/api/records/nope").header("X-Owner-Id", "alice"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown game: nope"));
    }

    @Test
    void testResetInfo() throws Exception {
        when(ingestionService.getResetInfo(eq("wordle"), isNull())).thenReturn(ResetInfoResponse.builder()
                .gameId("wordle")
                .resetTime("00:00")
                .zone("Z")
                .lastReset(Instant.parse("2024-01-16T00:00:00Z"))
                .nextReset(Instant.parse("2024-01-17T00:00:00Z"))
                .hoursUntilReset(12)
                .minutesUntilReset(0)
                .timeUntilReset("12:00")
                .currentPuzzleDay(LocalDate.of(2024, 1, 16))
                .build());

        mockMvc.perform(get("/api/games/wordle/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timeUntilReset").value("12:00"))
                .andExpect(jsonPath("$.lastReset").value("2024-01-16T00:00:00Z"));
    }

    @Test
    void testBadZoneIsBadRequest() throws Exception {
        when(ingestionService.getResetInfo("wordle", "Nowhere"))
                .thenThrow(new IllegalArgumentException("Unknown time zone: Nowhere"));

        mockMvc.perform(get("/api/games/wordle/reset").param("zone", "Nowhere"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown time zone: Nowhere"));
    }

    @Test
    void testListGames() throws Exception {
        when(catalog.all()).thenReturn(List.of(
                Game.builder().gameId("wordle").displayName("Wordle").resetTime("00:00").asynchronous(true).build()));

        mockMvc.perform(get("/api/games"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].gameId").value("wordle"))
                .andExpect(jsonPath("$[0].asynchronous").value(true));
    }
}
