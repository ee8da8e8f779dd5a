package com.solospot.rating.controller;

import com.solospot.rating.config.SpotRatingProperties;
import com.solospot.rating.dto.CommonResponse;
import com.solospot.rating.dto.RatingDTO;
import com.solospot.rating.dto.SpotStatisticsDTO;
import com.solospot.rating.dto.SubmitRatingRequest;
import com.solospot.rating.entity.Rating;
import com.solospot.rating.entity.RatingCategory;
import com.solospot.rating.service.RatingService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 单人友好度评分接口。
 * 用户身份由上游认证层解析后放在 X-User-Id 请求头中。
 */
@RestController
@RequestMapping("/api/v1")
public class RatingController {

    static final String USER_HEADER = "X-User-Id";

    private final RatingService ratingService;
    private final SpotRatingProperties properties;

    public RatingController(RatingService ratingService, SpotRatingProperties properties) {
        this.ratingService = ratingService;
        this.properties = properties;
    }

    /**
     * POST /api/v1/spots/{spotId}/ratings
     * 功能: 提交评分，同一用户重复提交时覆盖原评分
     */
    @PostMapping("/spots/{spotId}/ratings")
    public ResponseEntity<CommonResponse<RatingDTO>> submitRating(
            @PathVariable String spotId,
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody SubmitRatingRequest request) {

        Rating rating = ratingService.submitRating(spotId, userId, request.getScore(),
                request.getCategories(), request.getComment());

        return ResponseEntity.ok(CommonResponse.success(toDTO(rating)));
    }

    /**
     * GET /api/v1/spots/{spotId}/ratings
     * 功能: 地点的全部评分，最新的在前
     */
    @GetMapping("/spots/{spotId}/ratings")
    public ResponseEntity<CommonResponse<List<RatingDTO>>> getSpotRatings(@PathVariable String spotId) {
        return ResponseEntity.ok(CommonResponse.success(toDTOs(ratingService.getSpotRatings(spotId))));
    }

    @GetMapping("/spots/{spotId}/ratings/statistics")
    public ResponseEntity<CommonResponse<SpotStatisticsDTO>> getSpotStatistics(@PathVariable String spotId) {
        SpotStatisticsDTO dto = SpotStatisticsDTO.from(spotId, ratingService.getSpotStatistics(spotId));
        return ResponseEntity.ok(CommonResponse.success(dto));
    }

    @GetMapping("/users/{userId}/ratings")
    public ResponseEntity<CommonResponse<List<RatingDTO>>> getUserRatings(@PathVariable String userId) {
        return ResponseEntity.ok(CommonResponse.success(toDTOs(ratingService.getUserRatings(userId))));
    }

    /**
     * GET /api/v1/ratings/categories
     * 功能: 可用的分类标签词表
     */
    @GetMapping("/ratings/categories")
    public ResponseEntity<CommonResponse<List<String>>> getCategories() {
        return ResponseEntity.ok(CommonResponse.success(RatingCategory.validWireNames()));
    }

    private List<RatingDTO> toDTOs(List<Rating> ratings) {
        return ratings.stream().map(this::toDTO).collect(Collectors.toList());
    }

    private RatingDTO toDTO(Rating rating) {
        return RatingDTO.from(rating, Duration.ofHours(properties.getRecentUpdateWindowHours()));
    }
}
