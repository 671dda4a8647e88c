package com.aitracker.dedup.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Article row written by the ingestion pipeline. Read here only for the rolling dedup window.
 */
@Entity
@Table(name = "updates", indexes = {
    @Index(name = "idx_updates_date_scraped", columnList = "date_scraped"),
    @Index(name = "idx_updates_is_deleted", columnList = "is_deleted")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredArticle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", length = 500, nullable = false)
    private String title;

    @Column(name = "url", length = 1000, nullable = false, unique = true)
    private String url;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "date_published")
    private LocalDate datePublished;

    /** UTC time the article was stored; the rolling window is measured on this */
    @Column(name = "date_scraped")
    private LocalDateTime dateScraped;

    @Column(name = "is_deleted")
    @Builder.Default
    private Boolean deleted = false;
}
