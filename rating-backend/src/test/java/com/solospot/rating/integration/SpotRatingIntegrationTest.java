package com.solospot.rating.integration;

import com.solospot.rating.entity.Spot;
import com.solospot.rating.repository.RatingRepository;
import com.solospot.rating.repository.SpotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 【集成测试】评分提交到聚合统计写回的完整链路
 *
 * 测试环境：H2 内存库 (MySQL 模式)，对账任务关闭。
 * 不加 @Transactional：评分写入需要真正提交，重算才能读到。
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("评分系统集成测试")
class SpotRatingIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SpotRepository spotRepository;

    @Autowired
    private RatingRepository ratingRepository;

    @BeforeEach
    void setUp() {
        ratingRepository.deleteAll();
        spotRepository.deleteAll();

        Spot spot = new Spot();
        spot.setId("spot-1");
        spot.setName("Corner Library Cafe");
        spot.setLatitude(new BigDecimal("52.52000000"));
        spot.setLongitude(new BigDecimal("13.40500000"));
        spot.setCategory("cafe");
        spot.setCountryCode("DE");
        spotRepository.save(spot);
    }

    @Test
    @DisplayName("三个用户评分后，地点聚合为精确平均值")
    void testSubmitRatingsUpdatesAggregate() throws Exception {
        submit("user-1", 5, "[\"quiet_atmosphere\"]");
        submit("user-2", 3, "[]");
        submit("user-3", 4, "[\"wifi_available\",\"wifi_available\"]");

        Spot spot = spotRepository.findById("spot-1").orElseThrow();
        assertThat(spot.getAverageRating()).isEqualTo(4.0);
        assertThat(spot.getReviewCount()).isEqualTo(3);

        mockMvc.perform(get("/api/v1/spots/spot-1/ratings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(3)));
    }

    @Test
    @DisplayName("同一用户再次提交覆盖原评分，条数不变")
    void testResubmitReplacesRating() throws Exception {
        submit("user-1", 5, "[]");
        submit("user-2", 3, "[]");
        submit("user-1", 2, "[\"single_seating\"]");

        assertThat(ratingRepository.findBySpotIdAndUserId("spot-1", "user-1"))
                .get()
                .satisfies(r -> assertThat(r.getScore()).isEqualTo(2));

        Spot spot = spotRepository.findById("spot-1").orElseThrow();
        assertThat(spot.getAverageRating()).isEqualTo(2.5);
        assertThat(spot.getReviewCount()).isEqualTo(2);

        mockMvc.perform(get("/api/v1/spots/spot-1/ratings/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.average_rating").value(2.5))
                .andExpect(jsonPath("$.data.review_count").value(2));
    }

    @Test
    @DisplayName("非法分类不落库，聚合不变")
    void testInvalidCategoryRejected() throws Exception {
        mockMvc.perform(post("/api/v1/spots/spot-1/ratings")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"score\":4,\"categories\":[\"karaoke\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.field").value("category"));

        assertThat(ratingRepository.count()).isZero();
        assertThat(spotRepository.findById("spot-1").orElseThrow().getReviewCount()).isZero();
    }

    @Test
    void testUnknownSpot() throws Exception {
        mockMvc.perform(post("/api/v1/spots/ghost/ratings")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"score\":4}"))
                .andExpect(status().isNotFound());

        assertThat(ratingRepository.count()).isZero();
    }

    private void submit(String userId, int score, String categories) throws Exception {
        mockMvc.perform(post("/api/v1/spots/spot-1/ratings")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"score\":" + score + ",\"categories\":" + categories + "}"))
                .andExpect(status().isOk());
    }
}
