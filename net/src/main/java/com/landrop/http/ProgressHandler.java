package com.landrop.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landrop.transfer.ProgressSnapshot;
import com.landrop.transfer.UploadSessionRegistry;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;

/**
 * 上传进度查询，未知会话返回零值而不是错误
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
class ProgressHandler extends HandlerSupport {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final UploadSessionRegistry registry;

    ProgressHandler(UploadSessionRegistry registry) {
        this.registry = registry;
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws IOException {
        requireMethod(exchange, HTTP_GET);
        String uploadId = requireParam(exchange, UploadHandler.UPLOAD_ID_PARAM);
        ProgressSnapshot snapshot = registry.snapshot(uploadId).orElse(ProgressSnapshot.UNKNOWN);
        sendBytes(exchange, STATUS_OK, CONTENT_TYPE_JSON, toJson(snapshot));
    }

    /**
     * 序列化为 {"total":N,"uploaded":M}
     */
    static byte[] toJson(ProgressSnapshot snapshot) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsBytes(snapshot);
    }

}
