package com.landrop.http;

import java.io.IOException;

/**
 * multipart 请求体格式错误
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
public class MalformedMultipartException extends IOException {

    public MalformedMultipartException(String message) {
        super(message);
    }

}
