package com.aitracker.dedup.repository;

import com.aitracker.dedup.entity.StoredArticle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface StoredArticleRepository extends JpaRepository<StoredArticle, Long> {

    /**
     * Non-deleted articles stored at or after the cutoff, newest first.
     * Relies on the date_scraped index.
     */
    @Transactional(readOnly = true)
    @Query("SELECT a FROM StoredArticle a WHERE a.dateScraped >= :cutoff " +
           "AND (a.deleted = false OR a.deleted IS NULL) ORDER BY a.dateScraped DESC")
    List<StoredArticle> findWithinWindow(@Param("cutoff") LocalDateTime cutoff);
}
