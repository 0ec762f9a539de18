package com.crave.search.ondemand;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.crave.search.collection.CollectionArea;
import com.crave.search.collection.CollectionCycleResult;
import com.crave.search.collection.CollectionGateway;
import com.crave.search.collection.CollectionUnavailableException;
import com.crave.search.collection.PriorityTarget;
import com.crave.search.collection.SortPlanEntry;
import com.crave.search.plan.EntityScope;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OnDemandWorkerTest {
    private static final String REQUEST_ID = "5d1c7a0e-2f3b-4c5d-8e9f-0a1b2c3d4e5f";
    private static final String ENTITY_ID = "0f0e0d0c-0b0a-4908-8706-050403020100";
    private static final CollectionArea AUSTIN = new CollectionArea("austin", 7, 30.27, -97.74);
    private static final List<SortPlanEntry> SORTS = List.of(
        SortPlanEntry.of("new"),
        new SortPlanEntry("top", "year", null, null)
    );

    @Mock
    private OnDemandRequestRepository requestRepository;

    @Mock
    private PlaceholderEntityRepository placeholderRepository;

    @Mock
    private CollectionGateway collectionGateway;

    @Mock
    private ExecutorService onDemandExecutor;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OnDemandWorker worker;

    @BeforeEach
    void setUp() {
        worker = new OnDemandWorker(
            requestRepository,
            placeholderRepository,
            collectionGateway,
            new OnDemandProperties(),
            objectMapper,
            onDemandExecutor
        );
    }

    @Test
    void successfulCycleCompletesWithPlaceholderEntity() throws Exception {
        OnDemandJob job = job(EntityScope.RESTAURANT, OnDemandReason.UNRESOLVED, null, "Taqueria  del sol");
        when(requestRepository.markProcessing(eq(REQUEST_ID), any())).thenReturn(true);
        when(collectionGateway.executeKeywordSearchCycle(eq("austin"), anyList(), eq(SORTS)))
            .thenReturn(cycle("Taqueria Del Sol", 3, 12));
        when(placeholderRepository.findIdByName("Taqueria Del Sol", EntityScope.RESTAURANT, "austin")).thenReturn(null);
        when(placeholderRepository.createPlaceholder(
            eq("Taqueria Del Sol"),
            eq(EntityScope.RESTAURANT),
            eq("austin"),
            eq("Taqueria  del sol"),
            any()
        )).thenReturn(ENTITY_ID);

        worker.run(job);

        ArgumentCaptor<String> metadata = ArgumentCaptor.forClass(String.class);
        verify(requestRepository).markCompleted(
            eq(REQUEST_ID),
            eq(ENTITY_ID),
            any(),
            eq(List.of("austin")),
            metadata.capture()
        );
        JsonNode written = objectMapper.readTree(metadata.getValue());
        assertThat(written.path("posts").asInt()).isEqualTo(3);
        assertThat(written.path("comments").asInt()).isEqualTo(12);
        assertThat(written.path("sortHistory").path("top").path("lastTimeFilter").asText()).isEqualTo("year");
        assertThat(written.path("sortHistory").path("new").has("lastRunAt")).isTrue();
        assertThat(written.path("context").path("foodCount").asInt()).isEqualTo(1);
    }

    @Test
    void emptyCycleReturnsToPendingWithCooldown() throws Exception {
        OnDemandJob job = job(EntityScope.FOOD, OnDemandReason.UNRESOLVED, null, "birria tacos");
        when(requestRepository.markProcessing(eq(REQUEST_ID), any())).thenReturn(true);
        when(collectionGateway.executeKeywordSearchCycle(eq("austin"), anyList(), eq(SORTS)))
            .thenReturn(cycle("birria tacos", 0, 0));

        worker.run(job);

        ArgumentCaptor<String> metadata = ArgumentCaptor.forClass(String.class);
        verify(requestRepository).resetToPending(
            eq(REQUEST_ID),
            eq(OnDemandStatus.PROCESSING),
            eq(OnDemandOutcome.NO_RESULTS),
            any(),
            eq(List.of("austin")),
            metadata.capture()
        );
        JsonNode written = objectMapper.readTree(metadata.getValue());
        assertThat(written.has("instantCooldownUntil")).isTrue();
        assertThat(written.path("sortHistory").has("top")).isTrue();
        verify(requestRepository, never()).markCompleted(anyString(), anyString(), any(), anyList(), anyString());
        verifyNoInteractions(placeholderRepository);
    }

    @Test
    void failedCycleKeepsStoredMetadata() throws Exception {
        OnDemandJob job = job(EntityScope.FOOD, OnDemandReason.UNRESOLVED, null, "birria tacos");
        when(requestRepository.markProcessing(eq(REQUEST_ID), any())).thenReturn(true);
        doThrow(new CollectionUnavailableException("collection service returned 502"))
            .when(collectionGateway).executeKeywordSearchCycle(eq("austin"), anyList(), eq(SORTS));

        worker.run(job);

        ArgumentCaptor<String> metadata = ArgumentCaptor.forClass(String.class);
        verify(requestRepository).resetToPending(
            eq(REQUEST_ID),
            eq(OnDemandStatus.PROCESSING),
            eq(OnDemandOutcome.ERROR),
            any(),
            eq(List.of("austin")),
            metadata.capture()
        );
        JsonNode written = objectMapper.readTree(metadata.getValue());
        assertThat(written.path("lastError").asText()).isEqualTo("collection service returned 502");
        assertThat(written.path("context").path("foodCount").asInt()).isEqualTo(1);
        assertThat(written.path("sortHistory").isMissingNode()).isTrue();
    }

    @Test
    void jobThatLostProcessingRaceDoesNothing() {
        OnDemandJob job = job(EntityScope.FOOD, OnDemandReason.UNRESOLVED, null, "birria tacos");
        when(requestRepository.markProcessing(eq(REQUEST_ID), any())).thenReturn(false);

        worker.run(job);

        verifyNoInteractions(collectionGateway, placeholderRepository);
    }

    @Test
    void rejectedSubmissionReturnsRequestToPending() {
        OnDemandJob job = job(EntityScope.FOOD, OnDemandReason.UNRESOLVED, null, "birria tacos");
        doThrow(new RejectedExecutionException("full")).when(onDemandExecutor).execute(any(Runnable.class));
        when(requestRepository.markProcessing(eq(REQUEST_ID), any())).thenReturn(true);

        worker.submit(job);

        verify(requestRepository).resetToPending(
            eq(REQUEST_ID),
            eq(OnDemandStatus.PROCESSING),
            eq(OnDemandOutcome.ERROR),
            any(),
            eq(List.of()),
            anyString()
        );
    }

    @Test
    void lowResultRequestKeepsItsEntity() {
        OnDemandJob job = job(EntityScope.FOOD, OnDemandReason.LOW_RESULT, ENTITY_ID, "birria tacos");

        assertThat(worker.resolveEntityId(job, Instant.now())).isEqualTo(ENTITY_ID);
        verifyNoInteractions(placeholderRepository);

        PriorityTarget target = OnDemandWorker.buildPriorityTarget(job);
        assertThat(target.getEntityId()).isEqualTo(ENTITY_ID);
        assertThat(target.getScore()).isEqualTo(203);
        assertThat(target.isNewEntity()).isFalse();
        assertThat(target.getFactors().getDataRecency()).isEqualTo(2);
        assertThat(target.getFactors().getUserDemand()).isEqualTo(3);
    }

    @Test
    void unresolvedTargetUsesRequestIdAndFlagsNewEntity() {
        PriorityTarget target = OnDemandWorker.buildPriorityTarget(
            job(EntityScope.FOOD, OnDemandReason.UNRESOLVED, null, "birria tacos")
        );

        assertThat(target.getEntityId()).isEqualTo(REQUEST_ID);
        assertThat(target.getEntityName()).isEqualTo("birria tacos");
        assertThat(target.getEntityType()).isEqualTo("food");
        assertThat(target.getScore()).isEqualTo(103);
        assertThat(target.isNewEntity()).isTrue();
    }

    @Test
    void existingEntityWithSameNameIsReused() {
        OnDemandJob job = job(EntityScope.FOOD, OnDemandReason.UNRESOLVED, null, "birria tacos");
        when(placeholderRepository.findIdByName("birria tacos", EntityScope.FOOD, "austin")).thenReturn(ENTITY_ID);

        assertThat(worker.resolveEntityId(job, Instant.now())).isEqualTo(ENTITY_ID);
        verify(placeholderRepository, never()).createPlaceholder(anyString(), any(), anyString(), anyString(), any());
    }

    @Test
    void normalizesEntityNamesByType() {
        assertThat(OnDemandWorker.normalizeEntityName("  Birria   TACOS ", EntityScope.FOOD)).isEqualTo("birria tacos");
        assertThat(OnDemandWorker.normalizeEntityName("taqueria DEL sol", EntityScope.RESTAURANT))
            .isEqualTo("Taqueria Del Sol");
        assertThat(OnDemandWorker.normalizeEntityName("patio", EntityScope.RESTAURANT_ATTRIBUTE)).isEqualTo("Patio");
    }

    private OnDemandJob job(EntityScope type, OnDemandReason reason, String entityId, String term) {
        JsonNode stored = objectMapper.valueToTree(Map.of("context", Map.of("foodCount", 1)));
        OnDemandRequest request = new OnDemandRequest(
            REQUEST_ID,
            term,
            type,
            reason,
            "austin",
            3,
            OnDemandStatus.QUEUED,
            entityId,
            stored,
            0,
            1,
            List.of(),
            0,
            null,
            Instant.now(),
            Instant.now(),
            null,
            null
        );
        return new OnDemandJob(
            request,
            OnDemandWorker.normalizeEntityName(term, type),
            AUSTIN,
            SORTS,
            OnDemandMetadata.from(stored)
        );
    }

    private static CollectionCycleResult cycle(String term, int posts, int comments) {
        CollectionCycleResult result = new CollectionCycleResult();
        result.setSearchResults(Map.of(term, new CollectionCycleResult.TermSearch(posts, comments)));
        return result;
    }
}
