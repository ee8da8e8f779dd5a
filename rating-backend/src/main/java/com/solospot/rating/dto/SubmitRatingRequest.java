package com.solospot.rating.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * POST /api/v1/spots/{spotId}/ratings 请求体。
 * 分数范围和分类词表由 RatingValidator 校验，这里只管结构。
 */
@Data
public class SubmitRatingRequest {

    @NotNull
    private Integer score;

    private List<String> categories;

    private String comment;
}
