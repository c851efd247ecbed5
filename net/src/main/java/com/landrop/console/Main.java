package com.landrop.console;

import com.landrop.address.LanAddressResolver;
import com.landrop.config.TransferConfig;
import com.landrop.http.TransferServer;
import com.landrop.transfer.DownloadCatalog;
import com.landrop.transfer.UploadSessionRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

/**
 * 启动入口
 * <p>
 * 参数为预先加入下载目录的文件路径；带 --start 时立即以配置端口启动服务。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
public class Main {

    private static final String START_FLAG = "--start";

    public static void main(String[] args) throws IOException {
        TransferConfig config = TransferConfig.load();
        log.info("Loaded configuration: {}", config);

        DownloadCatalog catalog = new DownloadCatalog();
        boolean startNow = false;
        for (String arg : args) {
            if (START_FLAG.equals(arg)) {
                startNow = true;
                continue;
            }
            try {
                catalog.addPath(Paths.get(arg));
            } catch (IOException | IllegalArgumentException e) {
                log.error("Skipping {}: {}", arg, e.getMessage());
            }
        }

        UploadSessionRegistry registry = new UploadSessionRegistry();
        TransferServer server = new TransferServer(config, catalog, registry, new LanAddressResolver());

        // 优雅停止
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            server.stop();
            registry.clear();
        }, "transfer-shutdown"));

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        TransferConsole console = new TransferConsole(server, catalog, in, System.out, config.getPort());
        if (startNow) {
            console.execute("start");
        }
        console.run();
    }

}
