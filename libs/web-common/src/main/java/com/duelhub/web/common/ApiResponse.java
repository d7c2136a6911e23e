package com.duelhub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 参数错误（如未知流派）
     * 404: 对局/回合/参与者不存在
     * 409: 业务状态冲突（如重复锁定、阶段不符）
     * 500: 回合无法结算
     */
    int code,

    /**
     * 响应消息：失败时为 "原因码: 说明"
     */
    String message,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    /**
     * 失败响应（自定义状态码）
     */
    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return error(400, message);
    }

    /**
     * 失败响应（404 Not Found）
     */
    public static <T> ApiResponse<T> notFound(String message) {
        return error(404, message);
    }

    /**
     * 失败响应（409 Conflict）
     */
    public static <T> ApiResponse<T> conflict(String message) {
        return error(409, message);
    }

    /**
     * 失败响应（500 Internal Server Error）
     */
    public static <T> ApiResponse<T> serverError(String message) {
        return error(500, message);
    }

    /** 是否成功 */
    public boolean ok() {
        return code == 200;
    }
}
