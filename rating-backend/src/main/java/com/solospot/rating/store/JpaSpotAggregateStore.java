package com.solospot.rating.store;

import com.solospot.rating.exception.RatingStorageException;
import com.solospot.rating.repository.SpotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Component
public class JpaSpotAggregateStore implements SpotAggregateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSpotAggregateStore.class);

    private final SpotRepository spotRepository;
    private final Clock clock;

    public JpaSpotAggregateStore(SpotRepository spotRepository, Clock clock) {
        this.spotRepository = spotRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String spotId) {
        if (spotId == null || spotId.isBlank()) {
            return false;
        }
        try {
            return spotRepository.existsById(spotId);
        } catch (DataAccessException e) {
            throw new RatingStorageException("failed to look up spot " + spotId, e);
        }
    }

    @Override
    @Transactional
    public void updateAggregate(String spotId, double averageRating, int reviewCount) {
        int updated;
        try {
            updated = spotRepository.updateAggregate(spotId, averageRating, reviewCount, LocalDateTime.now(clock));
        } catch (DataAccessException e) {
            throw new RatingStorageException("failed to update spot statistics", e);
        }
        if (updated == 0) {
            throw new RatingStorageException("spot disappeared before statistics update: " + spotId);
        }
        log.debug("地点 {} 聚合统计已写回: avg={}, count={}", spotId, averageRating, reviewCount);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findAllSpotIds() {
        try {
            return spotRepository.findAllIds();
        } catch (DataAccessException e) {
            throw new RatingStorageException("failed to list spots", e);
        }
    }
}
