package com.puzzletracker.ingestion.repository;

import com.puzzletracker.ingestion.config.GameCatalogProperties;
import com.puzzletracker.ingestion.exception.UnknownGameException;
import com.puzzletracker.ingestion.model.Game;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Games known to the service, as configured under {@code puzzle-tracker.games}.
 * Reset times are validated on startup so a bad entry fails fast.
 */
@Slf4j
@Component
public class GameCatalog {

    private final Map<String, Game> games = new LinkedHashMap<>();

    public GameCatalog(GameCatalogProperties properties) {
        for (Game game : properties.getGames()) {
            if (game.getGameId() == null || game.getGameId().isBlank()) {
                throw new IllegalArgumentException("Configured game without gameId: " + game.getDisplayName());
            }
            game.resetLocalTime();
            games.put(game.getGameId(), game);
        }
        log.info("Loaded {} games into the catalog", games.size());
    }

    public Optional<Game> find(String gameId) {
        return Optional.ofNullable(games.get(gameId));
    }

    public Game require(String gameId) {
        return find(gameId).orElseThrow(() -> new UnknownGameException(gameId));
    }

    public Collection<Game> all() {
        return Collections.unmodifiableCollection(games.values());
    }
}
