package com.solospot.rating.dto;

import com.solospot.rating.entity.Rating;
import com.solospot.rating.entity.RatingCategory;
import lombok.Data;

import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

@Data
public class RatingDTO {
    private String id;
    private String spot_id;
    private String user_id;
    private Integer solo_friendly_rating;
    private List<String> categories;
    private String comment;
    private String created_at;        // ISO-8601
    private String updated_at;
    private Boolean recently_updated;

    public static RatingDTO from(Rating rating, Duration recentWindow) {
        RatingDTO dto = new RatingDTO();
        dto.setId(rating.getId());
        dto.setSpot_id(rating.getSpotId());
        dto.setUser_id(rating.getUserId());
        dto.setSolo_friendly_rating(rating.getScore());
        dto.setCategories(rating.getCategories().stream()
                .map(RatingCategory::getWireName)
                .collect(Collectors.toList()));
        dto.setComment(rating.getComment());
        dto.setCreated_at(rating.getCreatedAt() != null
                ? rating.getCreatedAt().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME) : null);
        dto.setUpdated_at(rating.getUpdatedAt() != null
                ? rating.getUpdatedAt().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME) : null);
        dto.setRecently_updated(rating.isRecentlyUpdated(recentWindow));
        return dto;
    }
}
