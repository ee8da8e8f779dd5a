package com.solospot.rating.service;

import com.solospot.rating.exception.AggregateSyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 默认上报实现：记 ERROR 日志，并把地点登记到失败表等待对账
 */
@Component
public class LoggingAggregateSyncErrorReporter implements AggregateSyncErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingAggregateSyncErrorReporter.class);

    private final AggregateSyncFailureRegistry failureRegistry;
    private final Clock clock;

    public LoggingAggregateSyncErrorReporter(AggregateSyncFailureRegistry failureRegistry, Clock clock) {
        this.failureRegistry = failureRegistry;
        this.clock = clock;
    }

    @Override
    public void report(AggregateSyncException failure) {
        log.error("地点 {} 聚合统计同步失败，已登记待对账: {}", failure.getSpotId(), failure.getMessage(), failure);
        failureRegistry.record(failure.getSpotId(), LocalDateTime.now(clock));
    }
}
