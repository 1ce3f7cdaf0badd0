package com.plugframe.dashboard.dto;

import com.plugframe.api.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一响应体
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {

    private boolean success;

    private String message;

    /**
     * 失败时的错误类型，成功时为 null
     */
    private ErrorKind errorKind;

    private T data;

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, null, data);
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, null, data);
    }

    public static <T> ApiResponse<T> error(ErrorKind errorKind, String message) {
        return new ApiResponse<>(false, message, errorKind, null);
    }

    public static <T> ApiResponse<T> error(ErrorKind errorKind, String message, T data) {
        return new ApiResponse<>(false, message, errorKind, data);
    }
}
