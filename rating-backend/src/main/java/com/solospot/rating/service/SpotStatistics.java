package com.solospot.rating.service;

import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 一组评分的聚合结果：平均分、条数、1-5 分布
 */
@Value
public class SpotStatistics {

    public static final SpotStatistics EMPTY = new SpotStatistics(0.0, 0, emptyDistribution());

    double averageRating;
    int reviewCount;
    // key: 分数 1-5，value: 条数，五个 key 始终存在
    Map<Integer, Integer> distribution;

    public SpotStatistics(double averageRating, int reviewCount, Map<Integer, Integer> distribution) {
        this.averageRating = averageRating;
        this.reviewCount = reviewCount;
        this.distribution = Collections.unmodifiableMap(new TreeMap<>(distribution));
    }

    static Map<Integer, Integer> emptyDistribution() {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (int score = 1; score <= 5; score++) {
            counts.put(score, 0);
        }
        return counts;
    }
}
