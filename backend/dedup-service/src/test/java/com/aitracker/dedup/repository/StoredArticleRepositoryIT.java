package com.aitracker.dedup.repository;

import com.aitracker.dedup.entity.StoredArticle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Testcontainers
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class StoredArticleRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine");

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    private static final LocalDateTime CUTOFF = LocalDateTime.of(2025, 6, 1, 12, 0);

    @Autowired
    private StoredArticleRepository repository;

    private StoredArticle article(String slug, LocalDateTime scraped, Boolean deleted) {
        return StoredArticle.builder()
                .title("Title " + slug)
                .url("https://news.example.com/" + slug)
                .dateScraped(scraped)
                .deleted(deleted)
                .build();
    }

    @Test
    @DisplayName("window query keeps rows at or after the cutoff that are not deleted, newest first")
    void findWithinWindow_returnsLiveRowsNewestFirst() {
        // given
        repository.saveAll(List.of(
                article("edge", CUTOFF, false),
                article("before", CUTOFF.minusSeconds(1), false),
                article("deleted", CUTOFF.plusDays(1), true),
                article("legacy", CUTOFF.plusDays(2), null),
                article("latest", CUTOFF.plusDays(5), false)));

        // when
        List<StoredArticle> rows = repository.findWithinWindow(CUTOFF);

        // then
        assertThat(rows).extracting(StoredArticle::getUrl).containsExactly(
                "https://news.example.com/latest",
                "https://news.example.com/legacy",
                "https://news.example.com/edge");
    }
}
