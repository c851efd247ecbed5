package com.landrop.http;

import com.landrop.transfer.DownloadCatalog;
import com.landrop.transfer.DownloadFile;
import com.sun.net.httpserver.HttpExchange;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLEncoder;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.StandardOpenOption;

/**
 * 按文件名下载目录中的文件
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
class DownloadHandler extends HandlerSupport {

    static final String FILE_PARAM = "file";

    private final DownloadCatalog catalog;

    DownloadHandler(DownloadCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws IOException {
        requireMethod(exchange, HTTP_GET);
        String name = requireParam(exchange, FILE_PARAM);
        DownloadFile target = catalog.find(name)
                .orElseThrow(() -> new HttpStatusException(STATUS_NOT_FOUND, "File not found: " + name));

        String clientIP = exchange.getRemoteAddress().getAddress().getHostAddress();
        // 打开失败时响应头尚未发出，由基类返回 500
        try (FileChannel fileChannel = FileChannel.open(target.getAbsolutePath(), StandardOpenOption.READ)) {
            long len = fileChannel.size();
            log.info("Download - ClientIP: {}, File: {}, Size: {} bytes", clientIP, name, len);

            exchange.getResponseHeaders().set(HEADER_CONTENT_TYPE, CONTENT_TYPE_OCTET_STREAM);
            exchange.getResponseHeaders().set(HEADER_CONTENT_DISPOSITION, contentDisposition(target.getDisplayName()));
            exchange.sendResponseHeaders(STATUS_OK, len == 0 ? -1 : len);
            if (len == 0) {
                return;
            }

            try (OutputStream os = exchange.getResponseBody();
                 WritableByteChannel responseChannel = Channels.newChannel(os)) {
                long position = 0;
                while (position < len) {
                    long sent = fileChannel.transferTo(position, len - position, responseChannel);
                    if (sent <= 0) {
                        break;
                    }
                    position += sent;
                }
                if (position < len) {
                    log.error("Download of {} truncated at {}/{} bytes", name, position, len);
                }
            } catch (IOException e) {
                // 响应头已发出，只能记录
                log.error("Download of {} to {} failed: {}", name, clientIP, e.getMessage());
            }
        }
    }

    /**
     * 附件响应头，非 ASCII 文件名通过 filename* 传递
     */
    static String contentDisposition(String filename) {
        StringBuilder fallback = new StringBuilder(filename.length());
        boolean ascii = true;
        for (int i = 0; i < filename.length(); i++) {
            char c = filename.charAt(i);
            if (c < 0x20 || c > 0x7e || c == '"' || c == '\\') {
                fallback.append('_');
                ascii = ascii && c >= 0x20 && c <= 0x7e;
            } else {
                fallback.append(c);
            }
        }
        String header = "attachment; filename=\"" + fallback + "\"";
        if (!ascii) {
            header += "; filename*=UTF-8''" + URLEncoder.encode(filename, StandardCharsets.UTF_8).replace("+", "%20");
        }
        return header;
    }

}
