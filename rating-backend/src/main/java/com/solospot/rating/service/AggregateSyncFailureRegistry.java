package com.solospot.rating.service;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 聚合同步失败的地点登记表（进程内死信集合），供对账任务消费。
 * 同一地点多次失败只保留首次失败时间。
 */
@Component
public class AggregateSyncFailureRegistry {

    private final Map<String, LocalDateTime> pending = new ConcurrentHashMap<>();

    public void record(String spotId, LocalDateTime failedAt) {
        pending.putIfAbsent(spotId, failedAt);
    }

    public void resolve(String spotId) {
        pending.remove(spotId);
    }

    public boolean isPending(String spotId) {
        return pending.containsKey(spotId);
    }

    /**
     * 当前待对账地点的快照
     */
    public Set<String> pendingSpotIds() {
        return Set.copyOf(pending.keySet());
    }

    public int size() {
        return pending.size();
    }
}
