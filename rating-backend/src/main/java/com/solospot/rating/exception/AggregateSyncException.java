package com.solospot.rating.exception;

/**
 * 评分写入成功之后，地点聚合统计重算/写回失败。
 * 不会抛给 submitRating 的调用方，只交给 AggregateSyncErrorReporter。
 */
public class AggregateSyncException extends RatingException {

    private final String spotId;

    public AggregateSyncException(String spotId, Throwable cause) {
        super("failed to sync aggregate for spot " + spotId + ": " + cause.getMessage(), cause);
        this.spotId = spotId;
    }

    public String getSpotId() {
        return spotId;
    }
}
