package com.landrop.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * 路由处理器基类：统一的异常到状态码映射、查询参数解析和响应输出
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
abstract class HandlerSupport implements HttpHandler {

    // ============ HTTP 协议常量 ============
    static final String HTTP_GET = "GET";
    static final String HTTP_HEAD = "HEAD";
    static final String HTTP_POST = "POST";
    static final String HEADER_ALLOW = "Allow";
    static final String HEADER_CONTENT_TYPE = "Content-Type";
    static final String HEADER_CONTENT_LENGTH = "Content-Length";
    static final String HEADER_CONTENT_DISPOSITION = "Content-Disposition";
    static final String CONTENT_TYPE_HTML = "text/html; charset=utf-8";
    static final String CONTENT_TYPE_TEXT = "text/plain; charset=utf-8";
    static final String CONTENT_TYPE_JSON = "application/json";
    static final String CONTENT_TYPE_OCTET_STREAM = "application/octet-stream";

    // ============ HTTP 状态码 ============
    static final int STATUS_OK = 200;
    static final int STATUS_BAD_REQUEST = 400;
    static final int STATUS_NOT_FOUND = 404;
    static final int STATUS_METHOD_NOT_ALLOWED = 405;
    static final int STATUS_CONFLICT = 409;
    static final int STATUS_PAYLOAD_TOO_LARGE = 413;
    static final int STATUS_INTERNAL_ERROR = 500;

    /**
     * 挂载路径，为 null 时匹配该上下文下的任意路径
     */
    private String contextPath;

    /**
     * 路径不完全匹配时的兜底处理器
     */
    private HttpHandler fallback;

    /**
     * 只处理与挂载路径完全相同的请求，其余交给兜底处理器
     * <p>
     * HttpServer 按前缀选择上下文，/uploads 之类的路径也会落到 /upload 上。
     */
    HandlerSupport mountAt(String contextPath, HttpHandler fallback) {
        this.contextPath = contextPath;
        this.fallback = fallback;
        return this;
    }

    @Override
    public final void handle(HttpExchange exchange) throws IOException {
        if (contextPath != null && !contextPath.equals(exchange.getRequestURI().getPath())) {
            fallback.handle(exchange);
            return;
        }
        String method = exchange.getRequestMethod();
        String uri = exchange.getRequestURI().toString();
        try {
            log.debug("[{}] {} from {}", method, uri, exchange.getRemoteAddress());
            doHandle(exchange);
        } catch (HttpStatusException e) {
            log.warn("[{}] {} -> {} {}", method, uri, e.getStatus(), e.getMessage());
            trySendError(exchange, e.getStatus(), e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.error("[{}] {} failed", method, uri, e);
            trySendError(exchange, STATUS_INTERNAL_ERROR, "Internal error: " + e.getMessage());
        } finally {
            exchange.close();
        }
    }

    protected abstract void doHandle(HttpExchange exchange) throws IOException;

    /**
     * 响应头是否已经发出
     */
    static boolean responseStarted(HttpExchange exchange) {
        return exchange.getResponseCode() != -1;
    }

    static void requireMethod(HttpExchange exchange, String... allowed) {
        String method = exchange.getRequestMethod();
        for (String candidate : allowed) {
            if (candidate.equalsIgnoreCase(method)) {
                return;
            }
        }
        exchange.getResponseHeaders().set(HEADER_ALLOW, String.join(", ", allowed));
        throw new HttpStatusException(STATUS_METHOD_NOT_ALLOWED, "Method not allowed: " + method);
    }

    /**
     * 读取必填的查询参数，缺失或为空时返回 400
     */
    static String requireParam(HttpExchange exchange, String name) {
        String value = parseQuery(exchange.getRequestURI().getRawQuery()).get(name);
        if (value == null || value.isEmpty()) {
            throw new HttpStatusException(STATUS_BAD_REQUEST, "Missing query parameter: " + name);
        }
        return value;
    }

    /**
     * 解析原始查询字符串（如 "uploadId=abc&file=a%20b.txt"），重复的键保留第一个值
     */
    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        try {
            for (String pair : rawQuery.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                String[] keyValue = pair.split("=", 2);
                String key = URLDecoder.decode(keyValue[0], StandardCharsets.UTF_8);
                String value = keyValue.length > 1 ? URLDecoder.decode(keyValue[1], StandardCharsets.UTF_8) : "";
                params.putIfAbsent(key, value);
            }
        } catch (IllegalArgumentException e) {
            throw new HttpStatusException(STATUS_BAD_REQUEST, "Malformed query string");
        }
        return params;
    }

    static void sendText(HttpExchange exchange, int status, String text) throws IOException {
        sendBytes(exchange, status, CONTENT_TYPE_TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    static void sendBytes(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().set(HEADER_CONTENT_TYPE, contentType);
        if (HTTP_HEAD.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(status, -1);
            return;
        }
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private static void trySendError(HttpExchange exchange, int status, String message) {
        if (responseStarted(exchange)) {
            return;
        }
        try {
            sendText(exchange, status, message == null ? "" : message);
        } catch (IOException e) {
            log.debug("Could not send {} response: {}", status, e.getMessage());
        }
    }

    static String escapeHtml(String s) {
        if (s == null) {
            return "";
        }
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;").replace("'", "&#39;");
    }

}
