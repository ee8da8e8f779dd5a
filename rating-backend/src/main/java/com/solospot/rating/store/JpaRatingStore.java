package com.solospot.rating.store;

import com.solospot.rating.entity.Rating;
import com.solospot.rating.exception.RatingStorageException;
import com.solospot.rating.repository.RatingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 基于 Spring Data JPA 的 RatingStore。
 * 写操作各自独立事务并立即 flush，提交后聚合重算才能读到。
 */
@Component
public class JpaRatingStore implements RatingStore {

    private static final Logger log = LoggerFactory.getLogger(JpaRatingStore.class);

    private final RatingRepository ratingRepository;

    public JpaRatingStore(RatingRepository ratingRepository) {
        this.ratingRepository = ratingRepository;
    }

    @Override
    @Transactional
    public void create(Rating rating) {
        try {
            ratingRepository.saveAndFlush(rating);
        } catch (DataAccessException e) {
            log.error("保存新评分失败: spot={}, user={}", rating.getSpotId(), rating.getUserId(), e);
            throw new RatingStorageException("failed to save new rating", e);
        }
    }

    @Override
    @Transactional
    public void update(Rating rating) {
        try {
            ratingRepository.saveAndFlush(rating);
        } catch (DataAccessException e) {
            log.error("更新评分失败: id={}", rating.getId(), e);
            throw new RatingStorageException("failed to save updated rating", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Rating> getBySpotAndUser(String spotId, String userId) {
        try {
            return ratingRepository.findBySpotIdAndUserId(spotId, userId);
        } catch (DataAccessException e) {
            throw new RatingStorageException("failed to check existing rating", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Rating> getBySpot(String spotId) {
        try {
            return ratingRepository.findBySpotIdOrderByCreatedAtDesc(spotId);
        } catch (DataAccessException e) {
            throw new RatingStorageException("failed to get spot ratings", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Rating> getByUser(String userId) {
        try {
            return ratingRepository.findByUserIdOrderByCreatedAtDesc(userId);
        } catch (DataAccessException e) {
            throw new RatingStorageException("failed to get user ratings", e);
        }
    }
}
