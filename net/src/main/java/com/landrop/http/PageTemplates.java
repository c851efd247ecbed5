package com.landrop.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * 页面模板加载
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
final class PageTemplates {

    static final String INDEX = "/static/index.html";
    static final String DOWNLOAD_LIST = "/static/download-list.html";
    static final String DOWNLOAD_ITEM = "/static/download-item.html";

    private PageTemplates() {
    }

    static String load(String resource) {
        try (InputStream is = PageTemplates.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Template resource missing: " + resource);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template resource: " + resource, e);
        }
    }

}
