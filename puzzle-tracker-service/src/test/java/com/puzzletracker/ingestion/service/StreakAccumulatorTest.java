package com.puzzletracker.ingestion.service;

import com.puzzletracker.ingestion.model.Game;
import com.puzzletracker.ingestion.model.GameRecord;
import com.puzzletracker.ingestion.model.RecordMetadata;
import com.puzzletracker.ingestion.model.StreakState;
import com.puzzletracker.ingestion.model.StreakSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StreakAccumulatorTest {

    private static final Game DAILY = Game.builder().gameId("wordle").resetTime("00:00").asynchronous(false).build();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-16T12:00:00Z"), ZoneOffset.UTC);

    private final StreakAccumulator accumulator = new StreakAccumulator(new PuzzlePeriodResolver(CLOCK));

    private static GameRecord record(Instant createdAt, boolean failed, StreakState streaks) {
        return GameRecord.builder()
                .gameId(DAILY.getGameId())
                .createdAt(createdAt)
                .failed(failed)
                .metadata(RecordMetadata.builder()
                        .playstreak(streaks.getPlaystreak())
                        .winstreak(streaks.getWinstreak())
                        .maxWinstreak(streaks.getMaxWinstreak())
                        .build())
                .build();
    }

    private static Instant day(int dayOfJanuary) {
        return Instant.parse("2024-01-01T12:00:00Z").plus(Duration.ofDays(dayOfJanuary - 1L));
    }

    @Nested
    @DisplayName("accumulate")
    class Accumulate {

        @Test
        void testFirstRecord() {
            assertEquals(new StreakState(1, 1, 1), accumulator.accumulate(false, day(1), null, DAILY));
            assertEquals(new StreakState(1, 0, 0), accumulator.accumulate(true, day(1), null, DAILY));
        }

        @Test
        void testConsecutiveWinsAndALoss() {
            StreakState first = accumulator.accumulate(false, day(1), null, DAILY);
            StreakState second = accumulator.accumulate(false, day(2), record(day(1), false, first), DAILY);
            assertEquals(new StreakState(2, 2, 2), second);

            StreakState loss = accumulator.accumulate(true, day(3), record(day(2), false, second), DAILY);
            assertEquals(new StreakState(3, 0, 2), loss, "A loss clears the win streak but not the maximum");

            StreakState comeback = accumulator.accumulate(false, day(4), record(day(3), true, loss), DAILY);
            assertEquals(new StreakState(4, 1, 2), comeback);
        }

        @Test
        void testGapResetsPlayStreak() {
            GameRecord prior = record(day(1), false, new StreakState(5, 5, 5));

            assertEquals(new StreakState(1, 1, 5), accumulator.accumulate(false, day(4), prior, DAILY));
            assertEquals(new StreakState(1, 0, 5), accumulator.accumulate(true, day(4), prior, DAILY));
        }

        @Test
        void testSamePuzzleDayRestarts() {
            GameRecord prior = record(day(2), false, new StreakState(3, 3, 4));
            assertEquals(new StreakState(1, 1, 4), accumulator.accumulate(false, day(2).plusSeconds(60), prior, DAILY));
        }

        @Test
        void testMinutesApartAcrossReset() {
            GameRecord prior = record(Instant.parse("2024-01-15T23:59:00Z"), false, new StreakState(1, 1, 1));
            assertEquals(new StreakState(2, 2, 2),
                    accumulator.accumulate(false, Instant.parse("2024-01-16T00:01:00Z"), prior, DAILY));
        }

        @Test
        void testYearRollover() {
            GameRecord prior = record(Instant.parse("2023-12-31T18:00:00Z"), false, new StreakState(9, 9, 9));
            assertEquals(new StreakState(10, 10, 10),
                    accumulator.accumulate(false, Instant.parse("2024-01-01T09:00:00Z"), prior, DAILY));
        }

        @Test
        void testConsecutiveAcrossDaylightSaving() {
            Game async = Game.builder().gameId("nerdle").resetTime("00:00").asynchronous(true).build();
            ZoneId newYork = ZoneId.of("America/New_York");
            // Noon on March 9th and noon on March 10th in New York are only 23 hours apart
            GameRecord prior = record(Instant.parse("2024-03-09T17:00:00Z"), false, new StreakState(1, 1, 1));

            StreakState next = accumulator.accumulate(false, Instant.parse("2024-03-10T16:00:00Z"), prior, async, newYork);
            assertEquals(new StreakState(2, 2, 2), next);
        }

        @Test
        void testPriorWithoutStreakMetadata() {
            GameRecord bare = GameRecord.builder().gameId("wordle").createdAt(day(1)).build();
            assertEquals(new StreakState(1, 1, 1), accumulator.accumulate(false, day(2), bare, DAILY),
                    "A record without metadata counts as no prior record");

            GameRecord partial = GameRecord.builder().gameId("wordle").createdAt(day(1))
                    .metadata(new RecordMetadata()).build();
            assertEquals(new StreakState(2, 2, 2), accumulator.accumulate(false, day(2), partial, DAILY),
                    "Missing counters read as one");
        }

        @Test
        void testReplayMatchesRecurrence() {
            Random random = new Random(20240116L);
            int dayIndex = 0;
            GameRecord previous = null;
            boolean previousFailed = false;
            int play = 0;
            int win = 0;
            int max = 0;

            for (int n = 0; n < 500; n++) {
                int gap = n == 0 ? 0 : 1 + (random.nextInt(10) < 7 ? 0 : random.nextInt(3));
                dayIndex += gap;
                // Noon UTC give or take five hours, so the jitter never crosses a reset
                Instant timestamp = day(1).plus(Duration.ofDays(dayIndex)).plus(Duration.ofMinutes(random.nextInt(600) - 300));
                boolean failed = random.nextInt(4) == 0;

                // Reference step
                if (previous == null) {
                    play = 1;
                    win = failed ? 0 : 1;
                    max = win;
                } else if (gap == 1) {
                    play = play + 1;
                    win = failed ? 0 : (previousFailed ? 1 : win + 1);
                    max = Math.max(max, win);
                } else {
                    play = 1;
                    win = failed ? 0 : 1;
                    max = Math.max(max, win);
                }

                StreakState actual = accumulator.accumulate(failed, timestamp, previous, DAILY);
                assertEquals(new StreakState(play, win, max), actual, "Record " + n);
                assertTrue(actual.getWinstreak() <= actual.getMaxWinstreak());
                assertTrue(actual.getWinstreak() >= 0 && actual.getPlaystreak() >= 1);

                previous = record(timestamp, failed, actual);
                previousFailed = failed;
            }
        }
    }

    @Nested
    @DisplayName("findPriorRecord")
    class FindPrior {

        @Test
        void testPicksLatestEarlierPuzzleDay() {
            GameRecord older = record(day(13), false, new StreakState(1, 1, 1));
            GameRecord latest = record(day(15), false, new StreakState(2, 2, 2));
            GameRecord sameDay = record(day(16).minusSeconds(3600), false, new StreakState(3, 3, 3));
            GameRecord otherGame = record(day(15).plusSeconds(600), false, new StreakState(7, 7, 7));
            otherGame.setGameId("nerdle");

            List<GameRecord> history = new ArrayList<>(List.of(older, sameDay, otherGame, latest));
            assertSame(latest, accumulator.findPriorRecord(history, day(16), DAILY, ZoneOffset.UTC).orElse(null));
        }

        @Test
        void testEmptyHistory() {
            assertTrue(accumulator.findPriorRecord(List.of(), day(16), DAILY, ZoneOffset.UTC).isEmpty());
        }
    }

    @Nested
    @DisplayName("summarize")
    class Summarize {

        @Test
        void testPlayedToday() {
            StreakSummary summary = accumulator.summarize(record(day(16), false, new StreakState(4, 3, 6)), DAILY, ZoneOffset.UTC);
            assertEquals(4, summary.getPlaystreak());
            assertEquals(3, summary.getWinstreak());
            assertFalse(summary.isStreakAtRisk());
            assertEquals(LocalDate.of(2024, 1, 16), summary.getLastPlayedDay());
        }

        @Test
        void testPlayedYesterdayIsAtRisk() {
            StreakSummary summary = accumulator.summarize(record(day(15), false, new StreakState(4, 3, 6)), DAILY, ZoneOffset.UTC);
            assertTrue(summary.isStreakAtRisk());
            assertEquals(4, summary.getPlaystreak(), "Streak still stands until today's puzzle closes");
        }

        @Test
        void testMissedDayShowsZero() {
            GameRecord stale = record(day(14), false, new StreakState(4, 3, 6));
            StreakSummary summary = accumulator.summarize(stale, DAILY, ZoneOffset.UTC);

            assertEquals(0, summary.getPlaystreak());
            assertEquals(0, summary.getWinstreak());
            assertEquals(6, summary.getMaxWinstreak());
            assertFalse(summary.isStreakAtRisk());
            assertEquals(4, stale.getMetadata().getPlaystreak(), "Stored record is untouched");
        }

        @Test
        void testNoRecord() {
            StreakSummary summary = accumulator.summarize(null, DAILY, ZoneOffset.UTC);
            assertEquals(0, summary.getPlaystreak());
            assertEquals(0, summary.getMaxWinstreak());
            assertNull(summary.getLastPlayedDay());
        }
    }
}
