package com.solospot.rating.dto;

import com.solospot.rating.service.SpotStatistics;
import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

@Data
public class SpotStatisticsDTO {
    private String spot_id;
    private BigDecimal average_rating;   // 展示用，保留一位小数
    private Integer review_count;
    private Map<Integer, Integer> rating_distribution;

    public static SpotStatisticsDTO from(String spotId, SpotStatistics stats) {
        SpotStatisticsDTO dto = new SpotStatisticsDTO();
        dto.setSpot_id(spotId);
        dto.setAverage_rating(BigDecimal.valueOf(stats.getAverageRating()).setScale(1, RoundingMode.HALF_UP));
        dto.setReview_count(stats.getReviewCount());
        dto.setRating_distribution(stats.getDistribution());
        return dto;
    }
}
