package com.landrop.address;

import lombok.Value;

/**
 * 用于生成二维码的访问地址
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Value
public class SessionUrl {

    public enum Target {

        /**
         * 上传页面
         */
        UPLOAD,

        /**
         * 下载列表页面
         */
        DOWNLOAD

    }

    String url;

    Target target;

}
