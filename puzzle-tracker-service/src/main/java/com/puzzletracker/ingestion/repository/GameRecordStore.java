package com.puzzletracker.ingestion.repository;

import com.puzzletracker.ingestion.model.GameRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for game records, owned by the surrounding application.
 * <p>
 * Callers appending a record must hold the append lock for its (owner, game) pair, so
 * the record read as "most recent" is still the most recent when the new one is saved.
 */
public interface GameRecordStore {

    List<GameRecord> findByOwnerAndGame(String ownerId, String gameId);

    Optional<GameRecord> findLatest(String ownerId, String gameId);

    GameRecord save(GameRecord record);
}
