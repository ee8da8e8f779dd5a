package com.solospot.rating.service;

import com.solospot.rating.entity.Rating;
import com.solospot.rating.exception.AggregateSyncException;
import com.solospot.rating.exception.SpotNotFoundException;
import com.solospot.rating.store.RatingStore;
import com.solospot.rating.store.SpotAggregateStore;
import com.solospot.rating.util.SpotLockRegistry;
import com.solospot.rating.validation.RatingValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 【RatingServiceImpl】
 * 职责：评分 upsert 与地点聚合统计重算的协调者。
 *
 * 一致性约定：
 * 1. 评分是事实来源，聚合统计是派生投影，每次写入后从评分全集整体重算（非增量）。
 * 2. 同一地点的 upsert + 重算在 SpotLockRegistry 的同一把锁内执行，避免丢失更新；
 *    不同地点互不阻塞。
 * 3. 本方法不开外层事务：评分写入提交后再重算，重算读到的是已提交数据。
 * 4. 聚合写回失败不影响调用方结果，交给 AggregateSyncErrorReporter，由对账任务修复。
 */
@Service
public class RatingServiceImpl implements RatingService {

    private static final Logger log = LoggerFactory.getLogger(RatingServiceImpl.class);

    private final RatingStore ratingStore;
    private final SpotAggregateStore spotAggregateStore;
    private final SpotLockRegistry spotLocks;
    private final AggregateSyncErrorReporter errorReporter;
    private final Clock clock;

    public RatingServiceImpl(RatingStore ratingStore,
                             SpotAggregateStore spotAggregateStore,
                             SpotLockRegistry spotLocks,
                             AggregateSyncErrorReporter errorReporter,
                             Clock clock) {
        this.ratingStore = ratingStore;
        this.spotAggregateStore = spotAggregateStore;
        this.spotLocks = spotLocks;
        this.errorReporter = errorReporter;
        this.clock = clock;
    }

    @Override
    public Rating submitRating(String spotId, String userId, int score, List<String> categories, String comment) {
        RatingValidator.validateIdentity(spotId, userId);

        if (!spotAggregateStore.exists(spotId)) {
            throw new SpotNotFoundException(spotId);
        }

        return spotLocks.withLock(spotId, () -> {
            Rating saved = upsert(spotId, userId, score, categories, comment);
            syncAggregateQuietly(spotId);
            return saved;
        });
    }

    private Rating upsert(String spotId, String userId, int score, List<String> categories, String comment) {
        Optional<Rating> existing = ratingStore.getBySpotAndUser(spotId, userId);

        if (existing.isPresent()) {
            Rating rating = existing.get();
            // 校验失败时直接抛出，不触碰存储
            rating.update(score, categories, comment, clock);
            ratingStore.update(rating);
            log.info("更新评分: spot={}, user={}, score={}, id={}", spotId, userId, score, rating.getId());
            return rating;
        }

        Rating rating = Rating.create(spotId, userId, score, categories, comment, clock);
        ratingStore.create(rating);
        log.info("新建评分: spot={}, user={}, score={}, id={}", spotId, userId, score, rating.getId());
        return rating;
    }

    private void syncAggregateQuietly(String spotId) {
        try {
            recomputeSpotAggregate(spotId);
        } catch (AggregateSyncException e) {
            errorReporter.report(e);
        }
    }

    @Override
    public List<Rating> getSpotRatings(String spotId) {
        return ratingStore.getBySpot(spotId);
    }

    @Override
    public List<Rating> getUserRatings(String userId) {
        return ratingStore.getByUser(userId);
    }

    @Override
    public SpotStatistics getSpotStatistics(String spotId) {
        if (!spotAggregateStore.exists(spotId)) {
            throw new SpotNotFoundException(spotId);
        }
        return computeStatistics(ratingStore.getBySpot(spotId));
    }

    @Override
    public SpotStatistics computeStatistics(List<Rating> ratings) {
        if (ratings == null || ratings.isEmpty()) {
            return SpotStatistics.EMPTY;
        }

        long total = 0;
        Map<Integer, Integer> distribution = SpotStatistics.emptyDistribution();
        for (Rating rating : ratings) {
            total += rating.getScore();
            distribution.merge(rating.getScore(), 1, Integer::sum);
        }

        double average = (double) total / ratings.size();
        return new SpotStatistics(average, ratings.size(), distribution);
    }

    @Override
    public SpotStatistics recomputeSpotAggregate(String spotId) {
        return spotLocks.withLock(spotId, () -> {
            try {
                SpotStatistics stats = computeStatistics(ratingStore.getBySpot(spotId));
                spotAggregateStore.updateAggregate(spotId, stats.getAverageRating(), stats.getReviewCount());
                log.debug("地点 {} 聚合统计重算完成: avg={}, count={}",
                        spotId, stats.getAverageRating(), stats.getReviewCount());
                return stats;
            } catch (RuntimeException e) {
                throw new AggregateSyncException(spotId, e);
            }
        });
    }
}
