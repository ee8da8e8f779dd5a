package com.solospot.rating.service;

import com.solospot.rating.config.SpotRatingProperties;
import com.solospot.rating.exception.AggregateSyncException;
import com.solospot.rating.exception.RatingStorageException;
import com.solospot.rating.store.SpotAggregateStore;
import com.solospot.rating.util.SpotLockRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SpotAggregateReconciliationTaskTest {

    @Mock
    private RatingService ratingService;

    @Mock
    private SpotAggregateStore spotAggregateStore;

    private AggregateSyncFailureRegistry failureRegistry;
    private SpotRatingProperties properties;
    private SpotAggregateReconciliationTask task;

    @BeforeEach
    void setUp() {
        failureRegistry = new AggregateSyncFailureRegistry();
        properties = new SpotRatingProperties();
        task = new SpotAggregateReconciliationTask(ratingService, spotAggregateStore, failureRegistry,
                new SpotLockRegistry(), properties);
    }

    // 只处理登记表中的地点，成功后移出
    @Test
    void testReconcileOnce_ResolvesPendingSpots() {
        failureRegistry.record("spot-1", LocalDateTime.now());
        failureRegistry.record("spot-2", LocalDateTime.now());
        when(ratingService.recomputeSpotAggregate(anyString())).thenReturn(SpotStatistics.EMPTY);

        int reconciled = task.reconcileOnce();

        assertEquals(2, reconciled);
        assertEquals(0, failureRegistry.size());
        verify(ratingService).recomputeSpotAggregate("spot-1");
        verify(ratingService).recomputeSpotAggregate("spot-2");
        verifyNoInteractions(spotAggregateStore);
    }

    // 仍然失败的地点留在登记表
    @Test
    void testReconcileOnce_KeepsFailingSpots() {
        failureRegistry.record("spot-1", LocalDateTime.now());
        failureRegistry.record("spot-2", LocalDateTime.now());
        when(ratingService.recomputeSpotAggregate("spot-1"))
                .thenThrow(new AggregateSyncException("spot-1", new RatingStorageException("still down")));
        when(ratingService.recomputeSpotAggregate("spot-2")).thenReturn(SpotStatistics.EMPTY);

        int reconciled = task.reconcileOnce();

        assertEquals(1, reconciled);
        assertTrue(failureRegistry.isPending("spot-1"));
        assertFalse(failureRegistry.isPending("spot-2"));
    }

    @Test
    void testReconcileOnce_FullPassCoversAllSpots() {
        properties.getReconciliation().setFullPassEnabled(true);
        failureRegistry.record("spot-1", LocalDateTime.now());
        when(spotAggregateStore.findAllSpotIds()).thenReturn(List.of("spot-1", "spot-3"));
        when(ratingService.recomputeSpotAggregate(anyString())).thenReturn(SpotStatistics.EMPTY);

        int reconciled = task.reconcileOnce();

        assertEquals(2, reconciled);
        verify(ratingService, times(1)).recomputeSpotAggregate("spot-1");
        verify(ratingService, times(1)).recomputeSpotAggregate("spot-3");
    }

    @Test
    void testReconcileOnce_NothingPending() {
        assertEquals(0, task.reconcileOnce());
        verifyNoInteractions(ratingService);
    }

    @Test
    void testScheduledReconcile_Disabled() {
        properties.getReconciliation().setEnabled(false);
        failureRegistry.record("spot-1", LocalDateTime.now());

        task.scheduledReconcile();

        verifyNoInteractions(ratingService);
        assertTrue(failureRegistry.isPending("spot-1"));
    }
}
