package com.landrop.address;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * 从 Linux 的 /proc/net/route 读取默认网关
 * <p>
 * 每行格式：Iface Destination Gateway Flags ...，地址为小端十六进制。
 * 其他系统上文件不存在，返回空。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
public class ProcNetRouteGatewayLocator implements GatewayLocator {

    private static final Path DEFAULT_ROUTE_TABLE = Paths.get("/proc/net/route");

    private static final String DEFAULT_DESTINATION = "00000000";

    // 路由标志位
    private static final int RTF_UP = 0x1;
    private static final int RTF_GATEWAY = 0x2;

    private final Path routeTable;

    public ProcNetRouteGatewayLocator() {
        this(DEFAULT_ROUTE_TABLE);
    }

    public ProcNetRouteGatewayLocator(Path routeTable) {
        this.routeTable = routeTable;
    }

    @Override
    public Optional<InetAddress> locate() throws IOException {
        if (!Files.isReadable(routeTable)) {
            log.debug("Route table {} not readable", routeTable);
            return Optional.empty();
        }
        List<String> lines = Files.readAllLines(routeTable, StandardCharsets.US_ASCII);
        // 第一行是表头
        for (int i = 1; i < lines.size(); i++) {
            String[] fields = lines.get(i).trim().split("\\s+");
            if (fields.length < 4 || !DEFAULT_DESTINATION.equals(fields[1])) {
                continue;
            }
            try {
                int flags = Integer.parseInt(fields[3], 16);
                if ((flags & RTF_UP) == 0 || (flags & RTF_GATEWAY) == 0) {
                    continue;
                }
                InetAddress gateway = decodeLittleEndian(fields[2]);
                log.debug("Default gateway {} via {}", gateway.getHostAddress(), fields[0]);
                return Optional.of(gateway);
            } catch (NumberFormatException e) {
                log.debug("Skipping malformed route line: {}", lines.get(i));
            }
        }
        return Optional.empty();
    }

    static InetAddress decodeLittleEndian(String hex) throws IOException {
        long value = Long.parseLong(hex, 16);
        byte[] address = {
                (byte) (value & 0xff),
                (byte) ((value >> 8) & 0xff),
                (byte) ((value >> 16) & 0xff),
                (byte) ((value >> 24) & 0xff)
        };
        return InetAddress.getByAddress(address);
    }

}
