package com.aitracker.dedup.service.dedup;

import java.time.LocalDateTime;

/**
 * A previously stored article as returned by a {@link HistoryReader}.
 */
public record HistoryRecord(String title, String url, LocalDateTime storedAt) {}
