package com.landrop.http;

import com.landrop.transfer.DownloadCatalog;
import com.landrop.transfer.DownloadFile;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 下载列表页面，每次请求按目录当前内容渲染
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
class DownloadPageHandler extends HandlerSupport {

    private static final String FILES_PLACEHOLDER = "{{FILES}}";
    private static final String UPLOAD_PAGE_PLACEHOLDER = "{{UPLOAD_PAGE_PATH}}";
    static final String EMPTY_CATALOG_HTML = "<div class=\"empty-tip\">No files available for download</div>";

    private final DownloadCatalog catalog;

    private final String template;

    private final String itemTemplate;

    DownloadPageHandler(DownloadCatalog catalog) {
        this.catalog = catalog;
        this.template = PageTemplates.load(PageTemplates.DOWNLOAD_LIST)
                .replace(UPLOAD_PAGE_PLACEHOLDER, TransferServer.CONTEXT_ROOT);
        this.itemTemplate = PageTemplates.load(PageTemplates.DOWNLOAD_ITEM);
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws IOException {
        requireMethod(exchange, HTTP_GET, HTTP_HEAD);
        String page = template.replace(FILES_PLACEHOLDER, renderFiles(catalog.list()));
        sendBytes(exchange, STATUS_OK, CONTENT_TYPE_HTML, page.getBytes(StandardCharsets.UTF_8));
    }

    String renderFiles(List<DownloadFile> files) {
        if (files.isEmpty()) {
            return EMPTY_CATALOG_HTML;
        }
        StringBuilder html = new StringBuilder();
        for (DownloadFile file : files) {
            String url = TransferServer.CONTEXT_DOWNLOAD + "?" + DownloadHandler.FILE_PARAM + "="
                    + URLEncoder.encode(file.getDisplayName(), StandardCharsets.UTF_8);
            html.append(itemTemplate
                    .replace("{{URL}}", escapeHtml(url))
                    .replace("{{NAME}}", escapeHtml(file.getDisplayName()))
                    .replace("{{SIZE}}", String.valueOf(file.getSizeInKB())));
        }
        return html.toString();
    }

}
