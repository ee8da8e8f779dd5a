package com.solospot.rating.service;

import com.solospot.rating.config.SpotRatingProperties;
import com.solospot.rating.exception.AggregateSyncException;
import com.solospot.rating.store.SpotAggregateStore;
import com.solospot.rating.util.SpotLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 【聚合对账任务】
 * 定期对登记为同步失败的地点重新执行聚合重算；开启 full-pass 时覆盖全部地点。
 * 重算仍失败的地点留在登记表中，下一轮继续。
 * 重算与移出登记表在同一把地点锁内完成，期间的新失败不会被移出覆盖。
 */
@Service
public class SpotAggregateReconciliationTask {

    private static final Logger log = LoggerFactory.getLogger(SpotAggregateReconciliationTask.class);

    private final RatingService ratingService;
    private final SpotAggregateStore spotAggregateStore;
    private final AggregateSyncFailureRegistry failureRegistry;
    private final SpotLockRegistry spotLocks;
    private final SpotRatingProperties properties;

    public SpotAggregateReconciliationTask(RatingService ratingService,
                                           SpotAggregateStore spotAggregateStore,
                                           AggregateSyncFailureRegistry failureRegistry,
                                           SpotLockRegistry spotLocks,
                                           SpotRatingProperties properties) {
        this.ratingService = ratingService;
        this.spotAggregateStore = spotAggregateStore;
        this.failureRegistry = failureRegistry;
        this.spotLocks = spotLocks;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${spot-rating.reconciliation.interval-ms:60000}",
               initialDelayString = "${spot-rating.reconciliation.interval-ms:60000}")
    public void scheduledReconcile() {
        if (!properties.getReconciliation().isEnabled()) {
            return;
        }
        reconcileOnce();
    }

    /**
     * 执行一轮对账
     * @return 本轮重算成功的地点数
     */
    public int reconcileOnce() {
        Set<String> targets = new LinkedHashSet<>(failureRegistry.pendingSpotIds());
        if (properties.getReconciliation().isFullPassEnabled()) {
            try {
                targets.addAll(spotAggregateStore.findAllSpotIds());
            } catch (RuntimeException e) {
                log.error("全量对账获取地点列表失败，本轮只处理失败登记表: {}", e.getMessage(), e);
            }
        }
        if (targets.isEmpty()) {
            return 0;
        }

        log.info("开始聚合对账，共 {} 个地点", targets.size());
        int reconciled = 0;
        for (String spotId : targets) {
            try {
                spotLocks.withLock(spotId, () -> {
                    ratingService.recomputeSpotAggregate(spotId);
                    failureRegistry.resolve(spotId);
                });
                reconciled++;
            } catch (AggregateSyncException e) {
                log.warn("地点 {} 对账失败，保留待下轮处理: {}", spotId, e.getMessage());
            }
        }
        log.info("聚合对账完成: 成功 {}, 剩余待处理 {}", reconciled, failureRegistry.size());
        return reconciled;
    }
}
