package com.aitracker.dedup.dto;

public record DedupStatsDTO(
        int urlsSeen,
        int titlesInMemory,
        int titlesFromHistory,
        boolean historyLoaded
) {}
