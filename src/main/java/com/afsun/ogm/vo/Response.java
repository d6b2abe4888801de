package com.afsun.ogm.vo;


import lombok.Data;

/**
 * 响应对象
 */
@Data
public class Response<T> {

    private String status;

    private T data;

    private String message;

    /**
     * 失败时的错误码，如 REFERENTIAL_ERROR
     */
    private String errorCode;

    /**
     * 操作成功状态码
     */
    public static final String SUCCESS = "200";

    /**
     * 操作失败状态码
     */
    public static final String FAIL = "500";

    public Response() {
    }

    public Response(String status, T data, String message) {
        this.status = status;
        this.data = data;
        this.message = message;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(getStatus());
    }

    /**
     * 操作成功返回响应
     *
     * @param data 返回数据
     * @return 响应结果
     */
    public static <T> Response<T> success(T data) {
        return new Response<>(SUCCESS, data, "");
    }

    /**
     * 操作失败返回响应
     *
     * @param message 错误信息
     * @return 响应结果
     */
    public static <T> Response<T> fail(String message) {
        return new Response<>(FAIL, null, message);
    }

    /**
     * 操作失败返回响应，支持整数状态码
     *
     * @param statusCode 状态码
     * @param message    错误信息
     * @return 响应结果
     */
    public static <T> Response<T> fail(int statusCode, String message) {
        return new Response<>(String.valueOf(statusCode), null, message);
    }

    /**
     * 操作失败返回响应，附带错误码
     *
     * @param statusCode 状态码
     * @param errorCode  错误码
     * @param message    错误信息
     * @return 响应结果
     */
    public static <T> Response<T> fail(int statusCode, String errorCode, String message) {
        Response<T> response = fail(statusCode, message);
        response.setErrorCode(errorCode);
        return response;
    }
}
