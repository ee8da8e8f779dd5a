package com.solospot.rating.exception;

/**
 * 输入校验失败。field 为出错字段（spotId / userId / score / category），
 * value 为出错的具体值，仅 category 时给出。
 */
public class InvalidRatingInputException extends RatingException {

    private final String field;
    private final String value;

    public InvalidRatingInputException(String field, String reason) {
        this(field, null, reason);
    }

    public InvalidRatingInputException(String field, String value, String reason) {
        super(reason);
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }
}
