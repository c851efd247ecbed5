package com.landrop.http;

import java.io.IOException;

/**
 * 请求体超过上传上限
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
public class PayloadTooLargeException extends IOException {

    public PayloadTooLargeException(long limit) {
        super("Request body exceeds " + limit + " bytes");
    }

}
