package com.landrop.http;

/**
 * 服务生命周期错误，例如端口已被占用
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
public class TransferServerException extends Exception {

    public TransferServerException(String message, Throwable cause) {
        super(message, cause);
    }

}
