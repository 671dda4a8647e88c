package com.aitracker.dedup.service.dedup;

import java.time.LocalDateTime;

/**
 * An article already known to the current run, with its entities extracted once.
 */
public record SeenArticle(String title, String url, LocalDateTime date, EntitySet entities) {}
