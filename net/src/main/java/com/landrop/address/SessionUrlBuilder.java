package com.landrop.address;

import com.landrop.transfer.DownloadCatalog;

/**
 * 生成扫码访问地址：目录非空时指向下载列表页面，否则指向上传页面
 * <p>
 * 只在服务启动时计算一次，之后目录变化不会影响已生成的地址。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
public final class SessionUrlBuilder {

    public static final String UPLOAD_PATH = "/";
    public static final String DOWNLOAD_PAGE_PATH = "/download-page";

    private SessionUrlBuilder() {
    }

    public static SessionUrl build(String host, int port, DownloadCatalog catalog) {
        if (catalog.isEmpty()) {
            return new SessionUrl(url(host, port, UPLOAD_PATH), SessionUrl.Target.UPLOAD);
        }
        return new SessionUrl(url(host, port, DOWNLOAD_PAGE_PATH), SessionUrl.Target.DOWNLOAD);
    }

    private static String url(String host, int port, String path) {
        return "http://" + host + ":" + port + path;
    }

}
