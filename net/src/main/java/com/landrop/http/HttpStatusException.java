package com.landrop.http;

/**
 * 以指定 HTTP 状态码结束请求的客户端错误
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
public class HttpStatusException extends RuntimeException {

    private final int status;

    public HttpStatusException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

}
