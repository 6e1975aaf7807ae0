package com.puzzletracker.ingestion.service;

import com.puzzletracker.ingestion.model.Game;
import com.puzzletracker.ingestion.model.GameRecord;
import com.puzzletracker.ingestion.model.RecordMetadata;
import com.puzzletracker.ingestion.model.StreakState;
import com.puzzletracker.ingestion.model.StreakSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the streak counters of a new record from the record that precedes it.
 * <p>
 * Streaks advance only across consecutive puzzle days. A gap, or a second record on the
 * same or an earlier puzzle day, restarts both streaks at this record.
 */
@Slf4j
@Service
public class StreakAccumulator {

    private final PuzzlePeriodResolver resolver;

    public StreakAccumulator(PuzzlePeriodResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Calculate the streaks for a new record.
     *
     * @param failed    whether the new record is a loss
     * @param timestamp when the new record was played
     * @param prior     most recent earlier record for the same owner and game, or null
     */
    public StreakState accumulate(boolean failed, Instant timestamp, GameRecord prior, Game game, ZoneId localZone) {
        int winstreak = failed ? 0 : 1;
        if (prior == null || prior.getMetadata() == null || prior.getCreatedAt() == null) {
            return new StreakState(1, winstreak, winstreak);
        }

        RecordMetadata previous = prior.getMetadata();
        LocalDate currentDay = resolver.getPuzzleDay(timestamp, game, localZone);
        LocalDate priorDay = resolver.getPuzzleDay(prior.getCreatedAt(), game, localZone);
        long daysDiff = ChronoUnit.DAYS.between(priorDay, currentDay);

        int playstreak = 1;
        if (daysDiff == 1) {
            playstreak = orOne(previous.getPlaystreak()) + 1;
            if (failed) {
                winstreak = 0;
            } else if (!prior.isFailed()) {
                winstreak = orOne(previous.getWinstreak()) + 1;
            }
        }

        int maxWinstreak = Math.max(orOne(previous.getMaxWinstreak()), winstreak);
        log.debug("Streak for {} on {}: {} day(s) after {}, play={} win={} max={}",
                game.getGameId(), currentDay, daysDiff, priorDay, playstreak, winstreak, maxWinstreak);
        return new StreakState(playstreak, winstreak, maxWinstreak);
    }

    public StreakState accumulate(boolean failed, Instant timestamp, GameRecord prior, Game game) {
        return accumulate(failed, timestamp, prior, game, resolver.defaultZone());
    }

    /**
     * Pick the record a new record's streak builds on: the latest record of the same game
     * from a puzzle day strictly before the new record's puzzle day.
     */
    public Optional<GameRecord> findPriorRecord(Collection<GameRecord> history, Instant timestamp,
                                                Game game, ZoneId localZone) {
        LocalDate currentDay = resolver.getPuzzleDay(timestamp, game, localZone);
        return history.stream()
                .filter(r -> Objects.equals(r.getGameId(), game.getGameId()))
                .filter(r -> r.getCreatedAt() != null)
                .filter(r -> resolver.getPuzzleDay(r.getCreatedAt(), game, localZone).isBefore(currentDay))
                .max(Comparator.comparing(GameRecord::getCreatedAt));
    }

    /**
     * Streaks as they should be displayed now. Stored values are shown while the latest
     * record is from the current or previous puzzle day; once a day has been missed the
     * play and win streaks read as zero.
     */
    public StreakSummary summarize(GameRecord latest, Game game, ZoneId localZone) {
        if (latest == null || latest.getCreatedAt() == null) {
            return StreakSummary.builder().build();
        }
        RecordMetadata metadata = latest.getMetadata() != null ? latest.getMetadata() : new RecordMetadata();
        LocalDate lastDay = resolver.getPuzzleDay(latest.getCreatedAt(), game, localZone);
        LocalDate yesterday = resolver.currentPuzzleDay(game, localZone).minusDays(1);

        int playstreak = orZero(metadata.getPlaystreak());
        int winstreak = orZero(metadata.getWinstreak());
        boolean atRisk = lastDay.equals(yesterday);
        if (lastDay.isBefore(yesterday)) {
            playstreak = 0;
            winstreak = 0;
        }

        return StreakSummary.builder()
                .playstreak(playstreak)
                .winstreak(winstreak)
                .maxWinstreak(orZero(metadata.getMaxWinstreak()))
                .streakAtRisk(atRisk)
                .lastPlayedDay(lastDay)
                .build();
    }

    private static int orOne(Integer value) {
        return value == null ? 1 : value;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
