package com.landrop.http;

import com.landrop.address.LanAddressResolver;
import com.landrop.address.SessionUrl;
import com.landrop.address.SessionUrlBuilder;
import com.landrop.config.TransferConfig;
import com.landrop.transfer.DownloadCatalog;
import com.landrop.transfer.UploadSessionRegistry;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 局域网文件传输服务
 * <p>
 * 路由在构造时创建且只创建一次；启动、停止、重启只重建监听套接字和线程池。
 * 启动与停止由同一把锁串行化，避免并发启动重复绑定端口。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
public class TransferServer implements AutoCloseable {

    // ============ HTTP 路由常量 ============
    public static final String CONTEXT_ROOT = SessionUrlBuilder.UPLOAD_PATH;
    public static final String CONTEXT_UPLOAD = "/upload";
    public static final String CONTEXT_PROGRESS = "/progress";
    public static final String CONTEXT_DOWNLOAD = "/download";
    public static final String CONTEXT_DOWNLOAD_PAGE = SessionUrlBuilder.DOWNLOAD_PAGE_PATH;

    private static final int MAX_PORT = 65535;

    private final TransferConfig config;

    private final DownloadCatalog catalog;

    private final UploadSessionRegistry registry;

    private final LanAddressResolver addressResolver;

    /**
     * 路由表，构造后不再变化
     */
    private final Map<String, HttpHandler> routes;

    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private final AtomicInteger generation = new AtomicInteger();

    private volatile ServerState state = ServerState.STOPPED;

    private HttpServer server;

    private ExecutorService executor;

    private volatile int boundPort = -1;

    private volatile SessionUrl sessionUrl;

    public TransferServer(TransferConfig config, DownloadCatalog catalog, UploadSessionRegistry registry,
                          LanAddressResolver addressResolver) {
        this.config = config;
        this.catalog = catalog;
        this.registry = registry;
        this.addressResolver = addressResolver;
        this.routes = Collections.unmodifiableMap(createRoutes());
        log.info("Routes registered: {}", routes.keySet());
    }

    private Map<String, HttpHandler> createRoutes() {
        // 未匹配的路径一律返回上传页
        IndexHandler index = new IndexHandler();
        Map<String, HttpHandler> table = new LinkedHashMap<>();
        table.put(CONTEXT_ROOT, index);
        table.put(CONTEXT_UPLOAD, new UploadHandler(registry, config.getUploadDirectory(),
                config.getMaxUploadBytes(), config.getBufferSize()).mountAt(CONTEXT_UPLOAD, index));
        table.put(CONTEXT_PROGRESS, new ProgressHandler(registry).mountAt(CONTEXT_PROGRESS, index));
        table.put(CONTEXT_DOWNLOAD, new DownloadHandler(catalog).mountAt(CONTEXT_DOWNLOAD, index));
        table.put(CONTEXT_DOWNLOAD_PAGE, new DownloadPageHandler(catalog).mountAt(CONTEXT_DOWNLOAD_PAGE, index));
        return table;
    }

    /**
     * 在指定端口启动服务；已在运行时先关闭原有监听
     *
     * @param port 0 表示由系统分配
     * @return 本次启动生成的访问地址
     * @throws TransferServerException 端口绑定失败
     */
    public SessionUrl start(int port) throws TransferServerException {
        if (port < 0 || port > MAX_PORT) {
            throw new IllegalArgumentException("Port out of range 0-" + MAX_PORT + ": " + port);
        }
        lifecycleLock.lock();
        try {
            if (state == ServerState.RUNNING) {
                log.info("Restarting: stopping listener on port {}", boundPort);
                try {
                    stopLocked();
                } catch (RuntimeException e) {
                    log.warn("Failed to stop previous listener, binding new one anyway", e);
                    server = null;
                    executor = null;
                }
            }
            state = ServerState.STARTING;

            HttpServer created;
            try {
                created = HttpServer.create(new InetSocketAddress(port), 0);
            } catch (IOException e) {
                state = ServerState.STOPPED;
                log.error("Failed to bind port {}: {}", port, e.getMessage());
                throw new TransferServerException("Failed to start service on port " + port + ": " + e.getMessage(), e);
            }
            ExecutorService createdExecutor = Executors.newFixedThreadPool(config.getThreads(),
                    new RequestThreadFactory(generation.incrementAndGet()));
            int createdPort = created.getAddress().getPort();
            SessionUrl createdUrl;
            try {
                // 访问地址在开始接收请求之前确定
                createdUrl = SessionUrlBuilder.build(addressResolver.resolve(), createdPort, catalog);
                routes.forEach(created::createContext);
                created.setExecutor(createdExecutor);
                created.start();
            } catch (RuntimeException e) {
                created.stop(0);
                createdExecutor.shutdownNow();
                state = ServerState.STOPPED;
                throw e;
            }

            server = created;
            executor = createdExecutor;
            boundPort = createdPort;
            sessionUrl = createdUrl;
            state = ServerState.RUNNING;

            log.info("==================== TransferServer ====================");
            log.info("Server URL: {} ({})", sessionUrl.getUrl(), sessionUrl.getTarget());
            log.info("Upload directory: {}", config.getUploadDirectory().toAbsolutePath().normalize());
            log.info("Download catalog: {} file(s)", catalog.size());
            log.info("========================================================");
            return sessionUrl;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * 停止服务
     *
     * @return 没有运行中的服务时返回 false
     */
    public boolean stop() {
        lifecycleLock.lock();
        try {
            if (state != ServerState.RUNNING) {
                log.info("Stop requested but no service is running");
                return false;
            }
            stopLocked();
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void stopLocked() {
        HttpServer current = server;
        ExecutorService currentExecutor = executor;
        int port = boundPort;
        server = null;
        executor = null;
        boundPort = -1;
        state = ServerState.STOPPED;
        try {
            current.stop(config.getStopDelaySeconds());
        } finally {
            shutdownExecutor(currentExecutor);
        }
        int leaked = registry.activeCount();
        if (leaked > 0) {
            log.warn("{} upload session(s) still registered after stop", leaked);
        }
        log.info("Service on port {} stopped", port);
    }

    private void shutdownExecutor(ExecutorService current) {
        current.shutdown();
        try {
            if (!current.awaitTermination(config.getStopDelaySeconds(), TimeUnit.SECONDS)) {
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public ServerState state() {
        return state;
    }

    public boolean isRunning() {
        return state == ServerState.RUNNING;
    }

    /**
     * @return 监听端口，未运行时为 -1
     */
    public int port() {
        return boundPort;
    }

    /**
     * @return 最近一次启动生成的访问地址，从未启动时为 null
     */
    public SessionUrl sessionUrl() {
        return sessionUrl;
    }

    Map<String, HttpHandler> routes() {
        return routes;
    }

    private static final class RequestThreadFactory implements ThreadFactory {

        private final int generation;

        private final AtomicInteger counter = new AtomicInteger();

        RequestThreadFactory(int generation) {
            this.generation = generation;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "transfer-http-" + generation + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }

    }

}
