package com.solospot.rating.repository;

import com.solospot.rating.entity.Rating;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RatingRepository extends JpaRepository<Rating, String> {

    /**
     * 某用户对某地点的评分（唯一约束保证最多一条）
     */
    Optional<Rating> findBySpotIdAndUserId(String spotId, String userId);

    /**
     * 地点的全部评分，最新的在前
     */
    List<Rating> findBySpotIdOrderByCreatedAtDesc(String spotId);

    List<Rating> findByUserIdOrderByCreatedAtDesc(String userId);
}
