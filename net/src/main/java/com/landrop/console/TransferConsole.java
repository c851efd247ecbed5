package com.landrop.console;

import com.landrop.address.SessionUrl;
import com.landrop.config.TransferConfig;
import com.landrop.http.TransferServer;
import com.landrop.http.TransferServerException;
import com.landrop.transfer.DownloadCatalog;
import com.landrop.transfer.DownloadFile;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * 命令行操作界面：选择下载文件、启动/停止服务、显示扫码地址
 * <p>
 * 所有错误都输出给操作者，不会结束进程。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
public class TransferConsole {

    private static final String PROMPT = "> ";

    private static final String HELP = String.join(System.lineSeparator(),
            "Commands:",
            "  add <path>     offer a file for download",
            "  list           show files offered for download",
            "  start [port]   start (or restart) the service",
            "  stop           stop the service",
            "  help           show this help",
            "  quit           stop the service and exit");

    private final TransferServer server;

    private final DownloadCatalog catalog;

    private final BufferedReader in;

    private final PrintStream out;

    private final int defaultPort;

    public TransferConsole(TransferServer server, DownloadCatalog catalog, BufferedReader in, PrintStream out,
                           int defaultPort) {
        this.server = server;
        this.catalog = catalog;
        this.in = in;
        this.out = out;
        this.defaultPort = defaultPort;
    }

    /**
     * 读取命令直到 quit 或输入结束
     */
    public void run() throws IOException {
        out.println(HELP);
        String line;
        while (true) {
            out.print(PROMPT);
            out.flush();
            line = in.readLine();
            if (line == null || !execute(line)) {
                break;
            }
        }
        server.stop();
    }

    /**
     * 执行一条命令
     *
     * @return quit 时返回 false
     */
    public boolean execute(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        String[] parts = trimmed.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1].trim() : "";
        switch (command) {
            case "add":
                add(argument);
                return true;
            case "list":
                printCatalog();
                return true;
            case "start":
                start(argument);
                return true;
            case "stop":
                stop();
                return true;
            case "help":
                out.println(HELP);
                return true;
            case "quit":
            case "exit":
                server.stop();
                out.println("Bye");
                return false;
            default:
                out.println("Unknown command: " + command);
                out.println(HELP);
                return true;
        }
    }

    private void add(String path) {
        if (path.isEmpty()) {
            out.println("Usage: add <path>");
            return;
        }
        try {
            catalog.addPath(Paths.get(stripQuotes(path)));
            printCatalog();
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Cannot add {}: {}", path, e.getMessage());
            out.println("Cannot add file: " + e.getMessage());
        }
    }

    private void printCatalog() {
        List<DownloadFile> files = catalog.list();
        if (files.isEmpty()) {
            out.println("No files selected");
            return;
        }
        out.println("Selected files:");
        for (int i = 0; i < files.size(); i++) {
            DownloadFile file = files.get(i);
            out.printf("%d. %s (%d KB)%n", i + 1, file.getDisplayName(), file.getSizeInKB());
        }
    }

    private void start(String portArgument) {
        int port;
        try {
            port = portArgument.isEmpty() ? defaultPort : TransferConfig.parsePort(portArgument);
        } catch (IllegalArgumentException e) {
            out.println("Invalid port: " + e.getMessage());
            return;
        }
        try {
            SessionUrl url = server.start(port);
            if (url.getTarget() == SessionUrl.Target.DOWNLOAD) {
                out.println("Download service started");
                out.println("Download list: " + url.getUrl());
            } else {
                out.println("Upload service started");
                out.println("Upload page: " + url.getUrl());
            }
            out.println("Open this address on the other device (or scan it as a QR code)");
        } catch (TransferServerException e) {
            out.println("Failed to start service: " + e.getMessage());
        }
    }

    private void stop() {
        if (server.stop()) {
            out.println("Service stopped");
        } else {
            out.println("No service is running");
        }
    }

    private static String stripQuotes(String path) {
        if (path.length() >= 2 && path.startsWith("\"") && path.endsWith("\"")) {
            return path.substring(1, path.length() - 1);
        }
        return path;
    }

}
