package com.landrop.address;

import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;

/**
 * 默认网关查找
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@FunctionalInterface
public interface GatewayLocator {

    /**
     * @return 默认网关地址，找不到时为空
     * @throws IOException 读取路由信息失败
     */
    Optional<InetAddress> locate() throws IOException;

}
