package com.solospot.rating.store;

import java.util.List;

/**
 * 地点物化聚合统计的持久化。
 */
public interface SpotAggregateStore {

    boolean exists(String spotId);

    /**
     * @throws com.solospot.rating.exception.RatingStorageException 写入失败或地点已不存在
     */
    void updateAggregate(String spotId, double averageRating, int reviewCount);

    /**
     * 全量对账时遍历用
     */
    List<String> findAllSpotIds();
}
