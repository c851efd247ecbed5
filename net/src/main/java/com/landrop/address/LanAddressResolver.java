package com.landrop.address;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InterfaceAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Collections;
import java.util.Optional;

/**
 * 查找本机的局域网 IPv4 地址
 * <p>
 * 依次尝试：与默认网关同网段的网卡地址、出站 UDP 套接字的本地地址，都失败时返回 localhost。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
public class LanAddressResolver {

    public static final String LOOPBACK_LABEL = "localhost";

    /**
     * 仅用于选路，不会发送数据
     */
    private static final byte[] PROBE_ADDRESS = {8, 8, 8, 8};
    private static final int PROBE_PORT = 53;

    private final GatewayLocator gatewayLocator;

    private final boolean probeOutbound;

    public LanAddressResolver() {
        this(new ProcNetRouteGatewayLocator(), true);
    }

    public LanAddressResolver(GatewayLocator gatewayLocator, boolean probeOutbound) {
        this.gatewayLocator = gatewayLocator;
        this.probeOutbound = probeOutbound;
    }

    /**
     * 永不抛出异常，找不到时返回 {@link #LOOPBACK_LABEL}
     */
    public String resolve() {
        try {
            Optional<InetAddress> gateway = gatewayLocator.locate();
            if (gateway.isPresent()) {
                Optional<String> address = addressOnSubnetOf(gateway.get());
                if (address.isPresent()) {
                    return address.get();
                }
                log.warn("No interface shares a subnet with gateway {}", gateway.get().getHostAddress());
            }
        } catch (IOException e) {
            log.warn("Default gateway discovery failed: {}", e.getMessage());
        }

        if (probeOutbound) {
            Optional<String> address = outboundAddress();
            if (address.isPresent()) {
                return address.get();
            }
        }

        log.warn("Could not find a LAN address, falling back to {}", LOOPBACK_LABEL);
        return LOOPBACK_LABEL;
    }

    private Optional<String> addressOnSubnetOf(InetAddress gateway) throws SocketException {
        for (NetworkInterface iface : Collections.list(NetworkInterface.getNetworkInterfaces())) {
            if (!iface.isUp() || iface.isLoopback()) {
                continue;
            }
            for (InterfaceAddress ia : iface.getInterfaceAddresses()) {
                InetAddress address = ia.getAddress();
                if (address instanceof Inet4Address
                        && sameSubnet(address, gateway, ia.getNetworkPrefixLength())) {
                    log.debug("Using {} on {} (gateway {})", address.getHostAddress(), iface.getName(), gateway.getHostAddress());
                    return Optional.of(address.getHostAddress());
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> outboundAddress() {
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.connect(InetAddress.getByAddress(PROBE_ADDRESS), PROBE_PORT);
            InetAddress local = socket.getLocalAddress();
            if (local instanceof Inet4Address && !local.isAnyLocalAddress() && !local.isLoopbackAddress()) {
                return Optional.of(local.getHostAddress());
            }
        } catch (IOException e) {
            log.debug("Outbound address probe failed: {}", e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * 两个 IPv4 地址在给定前缀长度下是否属于同一网段
     */
    static boolean sameSubnet(InetAddress a, InetAddress b, int prefixLength) {
        if (!(a instanceof Inet4Address) || !(b instanceof Inet4Address) || prefixLength < 0 || prefixLength > 32) {
            return false;
        }
        int mask = prefixLength == 0 ? 0 : -1 << (32 - prefixLength);
        return (toInt(a) & mask) == (toInt(b) & mask);
    }

    private static int toInt(InetAddress address) {
        byte[] bytes = address.getAddress();
        return ((bytes[0] & 0xff) << 24) | ((bytes[1] & 0xff) << 16) | ((bytes[2] & 0xff) << 8) | (bytes[3] & 0xff);
    }

}
