package com.puzzletracker.ingestion.service;

import com.puzzletracker.ingestion.dto.IngestRecordRequest;
import com.puzzletracker.ingestion.dto.ResetInfoResponse;
import com.puzzletracker.ingestion.dto.ShareTextRequest;
import com.puzzletracker.ingestion.exception.DuplicateRecordException;
import com.puzzletracker.ingestion.model.Game;
import com.puzzletracker.ingestion.model.GameRecord;
import com.puzzletracker.ingestion.model.RecordMetadata;
import com.puzzletracker.ingestion.model.ResetCountdown;
import com.puzzletracker.ingestion.model.StreakState;
import com.puzzletracker.ingestion.model.StreakSummary;
import com.puzzletracker.ingestion.repository.GameCatalog;
import com.puzzletracker.ingestion.repository.GameRecordStore;
import com.puzzletracker.parser.ParsedResult;
import com.puzzletracker.parser.ScoreNormalizer;
import com.puzzletracker.parser.ShareTextParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Turns submitted share text into stored records with their streaks.
 * <p>
 * Appends for one (owner, game) pair are serialized, so the prior record used for the
 * streak is always the latest one in the store at the time of the write.
 */
@Slf4j
@Service
public class RecordIngestionService {

    private final GameCatalog catalog;
    private final GameRecordStore store;
    private final ShareTextParser parser;
    private final PuzzlePeriodResolver resolver;
    private final StreakAccumulator accumulator;
    private final Clock clock;

    private static final int LOCK_STRIPES = 64;

    /** Striped by the hash of "ownerId:gameId" */
    private final ReentrantLock[] appendLocks = new ReentrantLock[LOCK_STRIPES];

    public RecordIngestionService(GameCatalog catalog,
                                  GameRecordStore store,
                                  ShareTextParser parser,
                                  PuzzlePeriodResolver resolver,
                                  StreakAccumulator accumulator,
                                  Clock clock) {
        this.catalog = catalog;
        this.store = store;
        this.parser = parser;
        this.resolver = resolver;
        this.accumulator = accumulator;
        this.clock = clock;
        for (int i = 0; i < appendLocks.length; i++) {
            appendLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Parse share text without storing anything
     */
    public ParsedResult preview(ShareTextRequest request) {
        if (request.getGameId() == null || request.getGameId().isBlank()) {
            return parser.parse(request.getText());
        }
        return parseFor(catalog.require(request.getGameId()), request.getText());
    }

    /**
     * Create a record for the owner. The record's puzzle day comes from {@code playedAt}
     * (or now) and the game's reset time; its streaks come from the latest record on an
     * earlier puzzle day.
     *
     * @throws DuplicateRecordException if the owner already has a record for that puzzle day
     */
    public GameRecord ingest(String ownerId, IngestRecordRequest request) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id is required");
        }
        Game game = catalog.require(request.getGameId());
        ZoneId zone = resolveZone(request.getTimeZone());
        Instant playedAt = request.getPlayedAt() == null || request.getPlayedAt().isBlank()
                ? clock.instant()
                : PuzzlePeriodResolver.parseTimestamp(request.getPlayedAt(), zone);

        RecordMetadata metadata = RecordMetadata.builder().notes(request.getNotes()).build();
        Map<String, Map<String, Object>> scores;
        boolean failed;
        if (request.getShareText() != null && !request.getShareText().isBlank()) {
            ParsedResult parsed = parseFor(game, request.getShareText());
            scores = parsed.getScores();
            failed = parsed.isFailed();
            metadata.setShareText(request.getShareText().trim());
            metadata.setPuzzleNumber(parsed.getPuzzleNumber());
            metadata.setGrid(parsed.getGrid());
            metadata.setMaxAttempts(parsed.getMaxAttempts());
            if (parsed.hasWarnings()) {
                metadata.setHasInvalidShareText(true);
            }
        } else if (request.getScores() != null || request.getFailed() != null) {
            scores = ScoreNormalizer.pruneEmpty(request.getScores());
            failed = Boolean.TRUE.equals(request.getFailed());
        } else {
            throw new IllegalArgumentException("Either shareText or scores must be provided");
        }

        LocalDate puzzleDay = resolver.getPuzzleDay(playedAt, game, zone);
        ReentrantLock lock = lockFor(ownerId + ":" + game.getGameId());
        lock.lock();
        try {
            List<GameRecord> history = store.findByOwnerAndGame(ownerId, game.getGameId());
            boolean alreadyRecorded = history.stream().anyMatch(r -> puzzleDay.equals(r.getPuzzleDay()));
            if (alreadyRecorded) {
                log.warn("Rejected second {} record for owner {} on {}", game.getGameId(), ownerId, puzzleDay);
                throw new DuplicateRecordException(game.getGameId(), puzzleDay);
            }

            GameRecord prior = accumulator.findPriorRecord(history, playedAt, game, zone).orElse(null);
            StreakState streaks = accumulator.accumulate(failed, playedAt, prior, game, zone);
            metadata.setPlaystreak(streaks.getPlaystreak());
            metadata.setWinstreak(streaks.getWinstreak());
            metadata.setMaxWinstreak(streaks.getMaxWinstreak());

            GameRecord record = GameRecord.builder()
                    .recordId(UUID.randomUUID().toString())
                    .ownerId(ownerId)
                    .gameId(game.getGameId())
                    .puzzleDay(puzzleDay)
                    .createdAt(playedAt)
                    .updatedAt(clock.instant())
                    .scores(scores)
                    .failed(failed)
                    .metadata(metadata)
                    .build();
            store.save(record);
            log.info("Recorded {} for owner {} on {} (failed={}, playstreak={}, winstreak={})",
                    game.getGameId(), ownerId, puzzleDay, failed, streaks.getPlaystreak(), streaks.getWinstreak());
            return record;
        } finally {
            lock.unlock();
        }
    }

    public List<GameRecord> getRecords(String ownerId, String gameId) {
        catalog.require(gameId);
        return store.findByOwnerAndGame(ownerId, gameId).stream()
                .sorted(Comparator.comparing(GameRecord::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    public StreakSummary getStreakSummary(String ownerId, String gameId, String timeZone) {
        Game game = catalog.require(gameId);
        GameRecord latest = store.findLatest(ownerId, gameId).orElse(null);
        return accumulator.summarize(latest, game, resolveZone(timeZone));
    }

    public ResetInfoResponse getResetInfo(String gameId, String timeZone) {
        Game game = catalog.require(gameId);
        ZoneId zone = resolveZone(timeZone);
        ResetCountdown countdown = resolver.getTimeUntilReset(game, zone);
        return ResetInfoResponse.builder()
                .gameId(game.getGameId())
                .resetTime(game.getResetTime())
                .zone(resolver.frameFor(game, zone).getId())
                .lastReset(resolver.getLastResetInstant(game, zone))
                .nextReset(resolver.getNextResetInstant(game, zone))
                .hoursUntilReset(countdown.getHours())
                .minutesUntilReset(countdown.getMinutes())
                .timeUntilReset(countdown.format())
                .currentPuzzleDay(resolver.currentPuzzleDay(game, zone))
                .build();
    }

    /**
     * @throws IllegalArgumentException if {@code timeZone} is not a valid zone id
     */
    public ZoneId resolveZone(String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return resolver.defaultZone();
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown time zone: " + timeZone, e);
        }
    }

    ReentrantLock lockFor(String ownerGameKey) {
        return appendLocks[Math.floorMod(ownerGameKey.hashCode(), appendLocks.length)];
    }

    // Games without a dedicated grammar go through detection and the generic reading
    private ParsedResult parseFor(Game game, String text) {
        String grammarName = game.getDisplayName() != null ? game.getDisplayName() : game.getGameId();
        if (parser.getRegistry().find(grammarName).isPresent()) {
            return parser.parse(text, grammarName);
        }
        ParsedResult result = parser.parse(text);
        if (result.hasWarnings()) {
            log.warn("Share text for {} parsed with warnings: {}", game.getGameId(), result.getParseWarnings());
        }
        return result;
    }
}
