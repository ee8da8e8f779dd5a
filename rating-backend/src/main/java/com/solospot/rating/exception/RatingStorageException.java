package com.solospot.rating.exception;

/**
 * 评分主写入（或读取）时存储层失败，整个 submitRating 视为失败。
 */
public class RatingStorageException extends RatingException {

    public RatingStorageException(String message) {
        super(message);
    }

    public RatingStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
