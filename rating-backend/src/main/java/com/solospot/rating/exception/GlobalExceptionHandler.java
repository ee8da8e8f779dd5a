package com.solospot.rating.exception;

import com.solospot.rating.dto.CommonResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 将评分模块异常统一转换为 CommonResponse
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SpotNotFoundException.class)
    public ResponseEntity<CommonResponse<Map<String, String>>> handleNotFound(SpotNotFoundException ex) {
        log.warn("资源不存在: {}", ex.getMessage());
        Map<String, String> detail = new LinkedHashMap<>();
        detail.put("resource", ex.getResource());
        detail.put("id", ex.getResourceId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(CommonResponse.error(HttpStatus.NOT_FOUND.value(), ex.getMessage(), detail));
    }

    @ExceptionHandler(InvalidRatingInputException.class)
    public ResponseEntity<CommonResponse<Map<String, String>>> handleInvalidInput(InvalidRatingInputException ex) {
        log.warn("评分输入不合法: field={}, {}", ex.getField(), ex.getMessage());
        Map<String, String> detail = new LinkedHashMap<>();
        detail.put("field", ex.getField());
        if (ex.getValue() != null) {
            detail.put("value", ex.getValue());
        }
        return ResponseEntity.badRequest()
                .body(CommonResponse.error(HttpStatus.BAD_REQUEST.value(), ex.getMessage(), detail));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CommonResponse<Map<String, String>>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> errors.put(error.getField(), error.getDefaultMessage()));
        return ResponseEntity.badRequest()
                .body(CommonResponse.error(HttpStatus.BAD_REQUEST.value(), "Validation failed", errors));
    }

    @ExceptionHandler({MissingRequestHeaderException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<CommonResponse<Void>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest()
                .body(CommonResponse.error(HttpStatus.BAD_REQUEST.value(), ex.getMessage()));
    }

    @ExceptionHandler(RatingStorageException.class)
    public ResponseEntity<CommonResponse<Void>> handleStorage(RatingStorageException ex) {
        log.error("评分存储失败: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(CommonResponse.error(HttpStatus.INTERNAL_SERVER_ERROR.value(), "storage error"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CommonResponse<Void>> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(CommonResponse.error(HttpStatus.INTERNAL_SERVER_ERROR.value(), "An unexpected error occurred"));
    }
}
