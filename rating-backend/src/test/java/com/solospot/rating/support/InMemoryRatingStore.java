package com.solospot.rating.support;

import com.solospot.rating.entity.Rating;
import com.solospot.rating.exception.RatingStorageException;
import com.solospot.rating.store.RatingStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 内存版 RatingStore，保存副本以模拟真实持久化。
 * readJitterMicros > 0 时，在读取评分集合前随机停顿，放大并发交错。
 */
public class InMemoryRatingStore implements RatingStore {

    private final Map<String, Rating> byId = new ConcurrentHashMap<>();
    private final AtomicBoolean failWrites = new AtomicBoolean(false);
    private final AtomicInteger writeCount = new AtomicInteger();
    private volatile int readJitterMicros = 0;

    public void setFailWrites(boolean fail) {
        failWrites.set(fail);
    }

    public void setReadJitterMicros(int micros) {
        this.readJitterMicros = micros;
    }

    public int writeCount() {
        return writeCount.get();
    }

    public int size() {
        return byId.size();
    }

    @Override
    public synchronized void create(Rating rating) {
        if (failWrites.get()) {
            throw new RatingStorageException("simulated create failure");
        }
        boolean duplicate = byId.values().stream()
                .anyMatch(r -> r.getSpotId().equals(rating.getSpotId()) && r.getUserId().equals(rating.getUserId()));
        if (duplicate || byId.containsKey(rating.getId())) {
            throw new RatingStorageException("duplicate rating for spot/user");
        }
        byId.put(rating.getId(), rating.copy());
        writeCount.incrementAndGet();
    }

    @Override
    public synchronized void update(Rating rating) {
        if (failWrites.get()) {
            throw new RatingStorageException("simulated update failure");
        }
        if (!byId.containsKey(rating.getId())) {
            throw new RatingStorageException("rating not found: " + rating.getId());
        }
        byId.put(rating.getId(), rating.copy());
        writeCount.incrementAndGet();
    }

    @Override
    public Optional<Rating> getBySpotAndUser(String spotId, String userId) {
        return byId.values().stream()
                .filter(r -> r.getSpotId().equals(spotId) && r.getUserId().equals(userId))
                .findFirst()
                .map(Rating::copy);
    }

    @Override
    public List<Rating> getBySpot(String spotId) {
        List<Rating> snapshot = byId.values().stream()
                .filter(r -> r.getSpotId().equals(spotId))
                .map(Rating::copy)
                .collect(Collectors.toList());
        jitter();
        snapshot.sort(Comparator.comparing(Rating::getCreatedAt).reversed());
        return snapshot;
    }

    @Override
    public List<Rating> getByUser(String userId) {
        return byId.values().stream()
                .filter(r -> r.getUserId().equals(userId))
                .map(Rating::copy)
                .sorted(Comparator.comparing(Rating::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    private void jitter() {
        int bound = readJitterMicros;
        if (bound <= 0) {
            return;
        }
        long micros = ThreadLocalRandom.current().nextLong(bound);
        try {
            Thread.sleep(micros / 1000, (int) (micros % 1000) * 1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
