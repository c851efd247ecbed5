package com.landrop.http;

import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 上传页面，页面内容固定，启动时渲染一次
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
class IndexHandler extends HandlerSupport {

    private static final String UPLOAD_PATH_PLACEHOLDER = "{{UPLOAD_PATH}}";
    private static final String PROGRESS_PATH_PLACEHOLDER = "{{PROGRESS_PATH}}";
    private static final String DOWNLOAD_PAGE_PLACEHOLDER = "{{DOWNLOAD_PAGE_PATH}}";

    private final byte[] page;

    IndexHandler() {
        this.page = PageTemplates.load(PageTemplates.INDEX)
                .replace(UPLOAD_PATH_PLACEHOLDER, TransferServer.CONTEXT_UPLOAD)
                .replace(PROGRESS_PATH_PLACEHOLDER, TransferServer.CONTEXT_PROGRESS)
                .replace(DOWNLOAD_PAGE_PLACEHOLDER, TransferServer.CONTEXT_DOWNLOAD_PAGE)
                .getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws IOException {
        requireMethod(exchange, HTTP_GET, HTTP_HEAD);
        sendBytes(exchange, STATUS_OK, CONTENT_TYPE_HTML, page);
    }

}
