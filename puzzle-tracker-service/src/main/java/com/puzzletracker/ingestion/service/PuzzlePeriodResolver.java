package com.puzzletracker.ingestion.service;

import com.puzzletracker.ingestion.model.Game;
import com.puzzletracker.ingestion.model.ResetCountdown;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.regex.Pattern;

/**
 * Maps instants to puzzle days.
 * <p>
 * A puzzle day starts at the game's reset time. Synchronous games reset at the same
 * instant for everyone (the reset time is read in UTC); asynchronous games reset at the
 * reset time on each player's own wall clock. All day arithmetic goes through
 * {@link LocalDate} and {@link ZonedDateTime}, so DST changes and month ends are exact.
 */
@Component
public class PuzzlePeriodResolver {

    private static final Pattern BARE_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private final Clock clock;

    public PuzzlePeriodResolver(Clock clock) {
        this.clock = clock;
    }

    /**
     * Zone used for asynchronous games when the caller does not name one.
     */
    public ZoneId defaultZone() {
        return clock.getZone();
    }

    /**
     * Time frame in which the game's reset time is read.
     */
    public ZoneId frameFor(Game game, ZoneId localZone) {
        return game.isAsynchronous() ? localZone : ZoneOffset.UTC;
    }

    /**
     * Get the puzzle day an instant falls in: the instant's calendar date in the game's
     * frame, or the day before if the wall-clock time is earlier than the reset time.
     */
    public LocalDate getPuzzleDay(Instant timestamp, Game game, ZoneId localZone) {
        LocalTime reset = game.resetLocalTime();
        ZonedDateTime local = timestamp.atZone(frameFor(game, localZone));
        LocalTime wallClock = LocalTime.of(local.getHour(), local.getMinute());
        LocalDate date = local.toLocalDate();
        return wallClock.isBefore(reset) ? date.minusDays(1) : date;
    }

    public LocalDate getPuzzleDay(Instant timestamp, Game game) {
        return getPuzzleDay(timestamp, game, defaultZone());
    }

    public LocalDate getPuzzleDay(String timestamp, Game game, ZoneId localZone) {
        return getPuzzleDay(parseTimestamp(timestamp, localZone), game, localZone);
    }

    public LocalDate currentPuzzleDay(Game game, ZoneId localZone) {
        return getPuzzleDay(clock.instant(), game, localZone);
    }

    /**
     * Check whether a record belongs to the puzzle that is live now.
     * <p>
     * A bare {@code yyyy-MM-dd} timestamp carries no time of day; it is compared with
     * today's UTC date directly, ignoring the reset time.
     */
    public boolean isCurrentPuzzle(String recordTimestamp, Game game, ZoneId localZone) {
        if (BARE_DATE.matcher(recordTimestamp.trim()).matches()) {
            return LocalDate.parse(recordTimestamp.trim()).equals(LocalDate.now(clock.withZone(ZoneOffset.UTC)));
        }
        return isCurrentPuzzle(parseTimestamp(recordTimestamp, localZone), game, localZone);
    }

    public boolean isCurrentPuzzle(Instant recordTimestamp, Game game, ZoneId localZone) {
        return getPuzzleDay(recordTimestamp, game, localZone).equals(currentPuzzleDay(game, localZone));
    }

    /**
     * Get the most recent instant at which the game reset.
     */
    public Instant getLastResetInstant(Game game, ZoneId localZone) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(frameFor(game, localZone)));
        ZonedDateTime reset = resetOn(game, now.toLocalDate(), now.getZone());
        if (reset.isAfter(now)) {
            reset = resetOn(game, now.toLocalDate().minusDays(1), now.getZone());
        }
        return reset.toInstant();
    }

    /**
     * Get the next instant at which the game will reset. Never equal to now.
     */
    public Instant getNextResetInstant(Game game, ZoneId localZone) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(frameFor(game, localZone)));
        ZonedDateTime reset = resetOn(game, now.toLocalDate(), now.getZone());
        if (!reset.isAfter(now)) {
            reset = resetOn(game, now.toLocalDate().plusDays(1), now.getZone());
        }
        return reset.toInstant();
    }

    /**
     * Get the time left until the next reset, in whole hours and remaining minutes.
     */
    public ResetCountdown getTimeUntilReset(Game game, ZoneId localZone) {
        long totalMinutes = Duration.between(clock.instant(), getNextResetInstant(game, localZone)).toMinutes();
        return new ResetCountdown(totalMinutes / 60, totalMinutes % 60);
    }

    /**
     * Parse an ISO-8601 timestamp. Bare dates are read as midnight UTC, local date-times
     * in the given zone.
     *
     * @throws IllegalArgumentException if the text is not an ISO-8601 date or timestamp
     */
    public static Instant parseTimestamp(String timestamp, ZoneId localZone) {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        String text = timestamp.trim();
        try {
            if (BARE_DATE.matcher(text).matches()) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (text.endsWith("Z") || text.endsWith("z")) {
                return Instant.parse(text.toUpperCase());
            }
            if (text.matches(".*[+-]\\d{2}:?\\d{2}$")) {
                return OffsetDateTime.parse(text).toInstant();
            }
            return LocalDateTime.parse(text).atZone(localZone).toInstant();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unreadable timestamp '" + timestamp + "'", e);
        }
    }

    // Built from the date, not by shifting another reset: a reset in a DST gap moves only on that day
    private static ZonedDateTime resetOn(Game game, LocalDate date, ZoneId zone) {
        return ZonedDateTime.of(date, game.resetLocalTime(), zone);
    }
}
