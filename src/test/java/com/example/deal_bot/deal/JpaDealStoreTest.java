package com.example.deal_bot.deal;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import com.example.deal_bot.TestFixtures;
import com.example.deal_bot.entity.CycleMetrics;
import com.example.deal_bot.entity.DealRecord;
import com.example.deal_bot.entity.PostRecord;
import com.example.deal_bot.pipeline.CycleState;
import com.example.deal_bot.pipeline.CycleStats;
import com.example.deal_bot.pipeline.PipelineProperties;
import com.example.deal_bot.repo.CycleMetricsRepository;
import com.example.deal_bot.repo.DealRecordRepository;
import com.example.deal_bot.repo.PostRecordRepository;
import com.example.deal_bot.service.StateTransitionService;

class JpaDealStoreTest {

    private DealRecordRepository dealRepo;
    private PostRecordRepository postRepo;
    private CycleMetricsRepository metricsRepo;
    private StateTransitionService transitions;
    private JpaDealStore store;

    @BeforeEach
    void setUp() {
        dealRepo = mock(DealRecordRepository.class);
        postRepo = mock(PostRecordRepository.class);
        metricsRepo = mock(CycleMetricsRepository.class);
        transitions = mock(StateTransitionService.class);
        PipelineProperties props = TestFixtures.props();
        props.setAffiliateTag("dealbot-20");
        store = new JpaDealStore(dealRepo, postRepo, metricsRepo, new AffiliateLinkBuilder(props),
                transitions, mock(PlatformTransactionManager.class));
    }

    @Test
    void saveCandidate_storesDerivedDiscountAndLinks() {
        when(dealRepo.save(any(DealRecord.class))).thenAnswer(inv -> {
            DealRecord d = inv.getArgument(0);
            d.setId(42L);
            return d;
        });

        Long id = store.saveCandidate(TestFixtures.serum().build());

        assertThat(id).isEqualTo(42L);
        ArgumentCaptor<DealRecord> saved = ArgumentCaptor.forClass(DealRecord.class);
        verify(dealRepo).save(saved.capture());
        assertThat(saved.getValue().getDiscountPercent()).isEqualByComparingTo("25.00");
        assertThat(saved.getValue().getSavingsAmount()).isEqualByComparingTo("9.75");
        assertThat(saved.getValue().getAffiliateUrl()).isEqualTo("https://www.amazon.com/dp/X1?tag=dealbot-20");
        assertThat(saved.getValue().isPosted()).isFalse();
    }

    @Test
    void connectionFailure_becomesStoreUnavailable() {
        when(dealRepo.save(any(DealRecord.class))).thenThrow(new DataAccessResourceFailureException("refused"));

        assertThatThrownBy(() -> store.saveCandidate(TestFixtures.serum().build()))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void otherDataErrors_passThrough() {
        when(dealRepo.save(any(DealRecord.class))).thenThrow(new DataIntegrityViolationException("dup"));

        assertThatThrownBy(() -> store.saveCandidate(TestFixtures.serum().build()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void findRecent_returnsLatestRowSinceAndMapsOutage() {
        Instant since = Instant.parse("2024-05-01T10:00:00Z");
        DealRecord row = new DealRecord();
        row.setProductId("X1");
        when(dealRepo.findFirstByProductIdAndDetectedAtGreaterThanEqualOrderByDetectedAtDesc("X1", since))
                .thenReturn(Optional.of(row));
        when(dealRepo.findFirstByProductIdAndDetectedAtGreaterThanEqualOrderByDetectedAtDesc("X2", since))
                .thenThrow(new DataAccessResourceFailureException("refused"));

        assertThat(store.findRecent("X1", since)).contains(row);
        assertThatThrownBy(() -> store.findRecent("X2", since))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void markPublished_updatesDealWritesPostAndAudits() {
        DealRecord d = new DealRecord();
        d.setId(7L);
        d.setProductId("X1");
        when(dealRepo.findById(7L)).thenReturn(Optional.of(d));
        Instant at = Instant.parse("2024-05-01T10:00:05Z");

        store.markPublished(7L, "1790000000000", "post body", at);

        assertThat(d.isPosted()).isTrue();
        assertThat(d.getPostId()).isEqualTo("1790000000000");
        ArgumentCaptor<PostRecord> post = ArgumentCaptor.forClass(PostRecord.class);
        verify(postRepo).save(post.capture());
        assertThat(post.getValue().getProductId()).isEqualTo("X1");
        assertThat(post.getValue().getPostedAt()).isEqualTo(at);
        verify(transitions).log(eq(StateTransitionService.TYPE_DEAL), eq("7"), eq("PERSISTED"), eq("PUBLISHED"),
                eq("POSTED"), anyString(), eq("BATCH"), any());
    }

    @Test
    void recordMetrics_mapsCycleStats() {
        CycleStats stats = CycleStats.builder()
                .cycleId("c-1")
                .startedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .finishedAt(Instant.parse("2024-05-01T10:00:09Z"))
                .finalState(CycleState.FAILED)
                .failureReason("UPSTREAM_UNAVAILABLE: timeout")
                .fetched(4)
                .publishErrors(2)
                .upstreamCalls(11)
                .elapsed(Duration.ofSeconds(9))
                .build();

        store.recordMetrics(stats);

        ArgumentCaptor<CycleMetrics> saved = ArgumentCaptor.forClass(CycleMetrics.class);
        verify(metricsRepo).save(saved.capture());
        assertThat(saved.getValue().getFinalState()).isEqualTo("FAILED");
        assertThat(saved.getValue().getFetched()).isEqualTo(4);
        assertThat(saved.getValue().getPublishErrors()).isEqualTo(2);
        assertThat(saved.getValue().getUpstreamCalls()).isEqualTo(11);
        assertThat(saved.getValue().getElapsedMillis()).isEqualTo(9000);
    }
}
