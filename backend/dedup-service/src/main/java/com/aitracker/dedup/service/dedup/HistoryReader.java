package com.aitracker.dedup.service.dedup;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read access to articles stored by earlier runs.
 */
public interface HistoryReader {

    /**
     * Returns every article stored at or after the cutoff, excluding soft-deleted ones.
     *
     * @param cutoff earliest storage timestamp to include (inclusive, UTC)
     * @return matching records, newest first
     * @throws RuntimeException when the store cannot be queried
     */
    List<HistoryRecord> findStoredSince(LocalDateTime cutoff);
}
