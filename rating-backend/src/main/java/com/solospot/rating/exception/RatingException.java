package com.solospot.rating.exception;

/**
 * 评分模块异常基类（非受检）。
 */
public abstract class RatingException extends RuntimeException {

    protected RatingException(String message) {
        super(message);
    }

    protected RatingException(String message, Throwable cause) {
        super(message, cause);
    }
}
