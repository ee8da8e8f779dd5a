package com.solospot.rating.service;

import com.solospot.rating.exception.AggregateSyncException;

/**
 * 聚合同步失败的旁路上报通道。
 * submitRating 不会因为聚合失败而失败，但失败必须经由这里留下记录。
 */
public interface AggregateSyncErrorReporter {

    void report(AggregateSyncException failure);
}
