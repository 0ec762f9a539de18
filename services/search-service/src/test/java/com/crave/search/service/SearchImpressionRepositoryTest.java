package com.crave.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.crave.search.plan.EntityScope;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class SearchImpressionRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    @SuppressWarnings("unchecked")
    void insertsOneRowPerImpression() {
        SearchImpressionRepository repository = new SearchImpressionRepository(jdbcTemplate);
        Instant loggedAt = Instant.parse("2024-06-01T12:00:00Z");

        repository.insertImpressions(List.of(
            new SearchImpression("food-1", EntityScope.FOOD, "austin", "birria"),
            new SearchImpression("rest-1", EntityScope.RESTAURANT, "austin", "birria")
        ), loggedAt);

        ArgumentCaptor<List<Object[]>> batch = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate).batchUpdate(eq(SearchImpressionRepository.INSERT_SQL), batch.capture());
        assertThat(batch.getValue()).hasSize(2);
        assertThat(batch.getValue().get(1))
            .containsExactly("rest-1", "restaurant", "austin", "birria", "search", Timestamp.from(loggedAt));
    }

    @Test
    void emptyListSkipsStore() {
        new SearchImpressionRepository(jdbcTemplate).insertImpressions(List.of(), Instant.now());

        verifyNoInteractions(jdbcTemplate);
    }
}
