package com.aitracker.dedup.service;

import com.aitracker.dedup.entity.StoredArticle;
import com.aitracker.dedup.exception.HistoryUnavailableException;
import com.aitracker.dedup.repository.StoredArticleRepository;
import com.aitracker.dedup.service.dedup.HistoryReader;
import com.aitracker.dedup.service.dedup.HistoryRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.LocalDateTime;
import java.util.List;

/**
 * {@link HistoryReader} over the relational article store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaHistoryReader implements HistoryReader {

    private final StoredArticleRepository storedArticleRepository;

    /**
     * Runs in the repository's own read-only transaction, so a failure to open it surfaces
     * here and is reported like any other store failure.
     */
    @Override
    public List<HistoryRecord> findStoredSince(LocalDateTime cutoff) {
        List<StoredArticle> rows;
        try {
            rows = storedArticleRepository.findWithinWindow(cutoff);
        } catch (DataAccessException | TransactionException e) {
            throw HistoryUnavailableException.queryFailed(cutoff, e);
        }
        log.debug("Fetched {} stored articles since {}", rows.size(), cutoff);
        return rows.stream()
                .map(row -> new HistoryRecord(row.getTitle(), row.getUrl(), row.getDateScraped()))
                .toList();
    }
}
