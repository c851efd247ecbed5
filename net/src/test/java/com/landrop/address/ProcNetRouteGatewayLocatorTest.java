package com.landrop.address;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProcNetRouteGatewayLocatorTest {

    private static final String HEADER =
            "Iface\tDestination\tGateway \tFlags\tRefCnt\tUse\tMetric\tMask\t\tMTU\tWindow\tIRTT\n";

    @TempDir
    Path tempDir;

    @Test
    void findsDefaultRouteGateway() throws Exception {
        Path table = Files.writeString(tempDir.resolve("route"), HEADER
                + "wlan0\t0001A8C0\t00000000\t0001\t0\t0\t600\t00FFFFFF\t0\t0\t0\n"
                + "wlan0\t00000000\t0101A8C0\t0003\t0\t0\t600\t00000000\t0\t0\t0\n");

        Optional<InetAddress> gateway = new ProcNetRouteGatewayLocator(table).locate();

        assertEquals("192.168.1.1", gateway.orElseThrow().getHostAddress());
    }

    @Test
    void ignoresRoutesWithoutGatewayFlag() throws Exception {
        Path table = Files.writeString(tempDir.resolve("route"), HEADER
                + "tun0\t00000000\t00000000\t0001\t0\t0\t0\t00000000\t0\t0\t0\n");

        assertTrue(new ProcNetRouteGatewayLocator(table).locate().isEmpty());
    }

    @Test
    void missingTableYieldsEmpty() throws Exception {
        assertTrue(new ProcNetRouteGatewayLocator(tempDir.resolve("absent")).locate().isEmpty());
    }

    @Test
    void decodesLittleEndianHex() throws Exception {
        assertEquals("10.0.0.254", ProcNetRouteGatewayLocator.decodeLittleEndian("FE00000A").getHostAddress());
    }
}
