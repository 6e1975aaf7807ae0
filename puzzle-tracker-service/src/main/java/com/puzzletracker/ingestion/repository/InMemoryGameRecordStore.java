package com.puzzletracker.ingestion.repository;

import com.puzzletracker.ingestion.model.GameRecord;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local record store used when no external repository is wired in.
 */
@Repository
public class InMemoryGameRecordStore implements GameRecordStore {

    /** Key: "ownerId:gameId" */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<GameRecord>> records = new ConcurrentHashMap<>();

    private static String key(String ownerId, String gameId) {
        return ownerId + ":" + gameId;
    }

    @Override
    public List<GameRecord> findByOwnerAndGame(String ownerId, String gameId) {
        return List.copyOf(records.getOrDefault(key(ownerId, gameId), new CopyOnWriteArrayList<>()));
    }

    @Override
    public Optional<GameRecord> findLatest(String ownerId, String gameId) {
        return findByOwnerAndGame(ownerId, gameId).stream()
                .max(Comparator.comparing(GameRecord::getCreatedAt));
    }

    @Override
    public GameRecord save(GameRecord record) {
        records.computeIfAbsent(key(record.getOwnerId(), record.getGameId()), k -> new CopyOnWriteArrayList<>())
                .add(record);
        return record;
    }
}
