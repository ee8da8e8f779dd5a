package com.solospot.rating.service;

import com.solospot.rating.entity.Rating;

import java.util.List;

public interface RatingService {

    /**
     * 提交（新建或覆盖）某用户对某地点的评分，并重算地点聚合统计
     *
     * @return 持久化后的评分
     * @throws com.solospot.rating.exception.SpotNotFoundException       地点不存在
     * @throws com.solospot.rating.exception.InvalidRatingInputException 输入不合法
     * @throws com.solospot.rating.exception.RatingStorageException      评分写入失败
     */
    Rating submitRating(String spotId, String userId, int score, List<String> categories, String comment);

    List<Rating> getSpotRatings(String spotId);

    List<Rating> getUserRatings(String userId);

    /**
     * 地点当前评分集合的统计（实时计算，不读物化值）
     */
    SpotStatistics getSpotStatistics(String spotId);

    SpotStatistics computeStatistics(List<Rating> ratings);

    /**
     * 从评分全集重算并写回地点聚合统计，与同一地点的其他写入串行
     *
     * @throws com.solospot.rating.exception.AggregateSyncException 读取或写回失败
     */
    SpotStatistics recomputeSpotAggregate(String spotId);
}
