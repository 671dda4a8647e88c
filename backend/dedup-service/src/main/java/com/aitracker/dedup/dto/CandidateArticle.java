package com.aitracker.dedup.dto;

import java.time.LocalDate;

/**
 * A scraped article awaiting the duplicate check. Identity is the URL.
 */
public record CandidateArticle(
        String url,
        String title,
        String content,
        LocalDate publishDate
) {
    public CandidateArticle {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Candidate article requires a url");
        }
        if (title == null) {
            throw new IllegalArgumentException("Candidate article requires a title: " + url);
        }
    }

    public static CandidateArticle of(String url, String title) {
        return new CandidateArticle(url, title, null, null);
    }
}
