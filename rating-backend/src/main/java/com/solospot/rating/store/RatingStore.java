package com.solospot.rating.store;

import com.solospot.rating.entity.Rating;

import java.util.List;
import java.util.Optional;

/**
 * 单条评分的持久化。
 * 所有方法在存储失败时抛出 {@link com.solospot.rating.exception.RatingStorageException}。
 */
public interface RatingStore {

    void create(Rating rating);

    void update(Rating rating);

    /**
     * 不存在时返回 empty，而不是抛异常
     */
    Optional<Rating> getBySpotAndUser(String spotId, String userId);

    List<Rating> getBySpot(String spotId);

    List<Rating> getByUser(String userId);
}
