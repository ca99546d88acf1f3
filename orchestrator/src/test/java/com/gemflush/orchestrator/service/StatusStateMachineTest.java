package com.gemflush.orchestrator.service;

import com.gemflush.orchestrator.TestFixtures;
import com.gemflush.orchestrator.model.BusinessStatus;
import com.gemflush.orchestrator.pipeline.BusinessNotFoundException;
import com.gemflush.orchestrator.pipeline.ConcurrencyConflictException;
import com.gemflush.orchestrator.pipeline.IllegalStatusTransitionException;
import com.gemflush.orchestrator.repository.BusinessRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatusStateMachineTest {

    @Mock BusinessRepository businessRepo;

    StatusStateMachine machine;
    UUID id = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        machine = new StatusStateMachine(businessRepo, TestFixtures.CLOCK);
    }

    // ------------------------------------------------------------------
    // transition()
    // ------------------------------------------------------------------

    @Test
    void transition_allowedAndRowMatches_writesConditionally() {
        when(businessRepo.compareAndSetStatus(id, BusinessStatus.PENDING, BusinessStatus.CRAWLING, TestFixtures.NOW))
                .thenReturn(1);

        assertThatCode(() -> machine.transition(id, BusinessStatus.PENDING, BusinessStatus.CRAWLING))
                .doesNotThrowAnyException();
        verify(businessRepo, never()).findStatusById(any());
    }

    @Test
    void transition_notInTable_rejectedWithoutTouchingTheDatabase() {
        assertThatThrownBy(() -> machine.transition(id, BusinessStatus.PENDING, BusinessStatus.PUBLISHED))
                .isInstanceOf(IllegalStatusTransitionException.class);
        verifyNoInteractions(businessRepo);
    }

    @Test
    void transition_rowMovedUnderneath_throwsConflict() {
        when(businessRepo.compareAndSetStatus(any(), any(), any(), any())).thenReturn(0);
        when(businessRepo.findStatusById(id)).thenReturn(Optional.of(BusinessStatus.CRAWLING));

        assertThatThrownBy(() -> machine.transition(id, BusinessStatus.PENDING, BusinessStatus.CRAWLING))
                .isInstanceOf(ConcurrencyConflictException.class)
                .hasMessageContaining("CRAWLING");
    }

    @Test
    void transition_rowDeleted_throwsNotFound() {
        when(businessRepo.compareAndSetStatus(any(), any(), any(), any())).thenReturn(0);
        when(businessRepo.findStatusById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> machine.transition(id, BusinessStatus.CRAWLED, BusinessStatus.GENERATING))
                .isInstanceOf(BusinessNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // fail() / markPublished() / reset()
    // ------------------------------------------------------------------

    @Test
    void fail_recordsErrorMessage() {
        when(businessRepo.compareAndSetStatusWithError(
                id, BusinessStatus.CRAWLING, BusinessStatus.ERROR, "crawl timed out", TestFixtures.NOW))
                .thenReturn(1);

        machine.fail(id, BusinessStatus.CRAWLING, "crawl timed out");

        verify(businessRepo).compareAndSetStatusWithError(
                eq(id), eq(BusinessStatus.CRAWLING), eq(BusinessStatus.ERROR), eq("crawl timed out"), any());
    }

    @Test
    void fail_fromPublished_isRejected() {
        assertThatThrownBy(() -> machine.fail(id, BusinessStatus.PUBLISHED, "boom"))
                .isInstanceOf(IllegalStatusTransitionException.class);
    }

    @Test
    void markPublished_blankQid_isRejected() {
        assertThatThrownBy(() -> machine.markPublished(id, " ", TestFixtures.NOW))
                .isInstanceOf(IllegalArgumentException.class);
        verify(businessRepo, never()).markPublished(any(), any(), anyString(), any(), any());
    }

    @Test
    void markPublished_fromGenerating_writesQidAndStatusTogether() {
        when(businessRepo.markPublished(id, BusinessStatus.GENERATING, "Q123", TestFixtures.NOW, TestFixtures.NOW))
                .thenReturn(1);

        machine.markPublished(id, "Q123", TestFixtures.NOW);

        verify(businessRepo).markPublished(id, BusinessStatus.GENERATING, "Q123", TestFixtures.NOW, TestFixtures.NOW);
    }

    @Test
    void reset_movesErrorToPending() {
        when(businessRepo.compareAndSetStatus(id, BusinessStatus.ERROR, BusinessStatus.PENDING, TestFixtures.NOW))
                .thenReturn(1);

        machine.reset(id);

        verify(businessRepo).compareAndSetStatus(id, BusinessStatus.ERROR, BusinessStatus.PENDING, TestFixtures.NOW);
    }

    @Test
    void updatePublication_stillPublished_writesNewQid() {
        when(businessRepo.updatePublication(id, "Q77", TestFixtures.NOW, TestFixtures.NOW)).thenReturn(1);

        machine.updatePublication(id, "Q77", TestFixtures.NOW);

        verify(businessRepo, never()).findStatusById(any());
    }

    @Test
    void updatePublication_noLongerPublished_throwsConflict() {
        when(businessRepo.updatePublication(id, "Q77", TestFixtures.NOW, TestFixtures.NOW)).thenReturn(0);
        when(businessRepo.findStatusById(id)).thenReturn(Optional.of(BusinessStatus.ERROR));

        assertThatThrownBy(() -> machine.updatePublication(id, "Q77", TestFixtures.NOW))
                .isInstanceOf(ConcurrencyConflictException.class)
                .hasMessageContaining("ERROR");
    }

    @Test
    void fail_abandonedGeneratingRow_movesToError() {
        when(businessRepo.compareAndSetStatusWithError(
                eq(id), eq(BusinessStatus.GENERATING), eq(BusinessStatus.ERROR), anyString(), eq(TestFixtures.NOW)))
                .thenReturn(1);

        assertThatCode(() -> machine.fail(id, BusinessStatus.GENERATING, "Run abandoned in GENERATING"))
                .doesNotThrowAnyException();
    }
}
