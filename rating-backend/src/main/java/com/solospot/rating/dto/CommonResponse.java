package com.solospot.rating.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 通用 API 响应结构
 *
 * @param <T> 业务数据类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonResponse<T> implements Serializable {

    // 状态码：200, 400, 404, 500
    private Integer code;

    private String message;

    // 业务数据，失败时为出错字段等附加信息或 null
    private T data;

    // 响应时间戳 (ms)
    private Long timestamp;

    public static <T> CommonResponse<T> success(T data) {
        return new CommonResponse<>(200, "请求成功", data, Instant.now().toEpochMilli());
    }

    public static <T> CommonResponse<T> error(Integer code, String message) {
        return error(code, message, null);
    }

    /**
     * 失败响应，附带错误详情（如出错字段）
     */
    public static <T> CommonResponse<T> error(Integer code, String message, T detail) {
        return new CommonResponse<>(code, message, detail, Instant.now().toEpochMilli());
    }
}
