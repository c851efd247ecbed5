package com.landrop.config;

import com.landrop.properties.PropertiesUtil;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Properties;

/**
 * 传输服务配置
 * <p>
 * 取值优先级：JVM 系统属性 &gt; landrop.properties &gt; 内置默认值
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class TransferConfig {

    public static final String KEY_PORT = "server.port";
    public static final String KEY_THREADS = "server.threads";
    public static final String KEY_STOP_DELAY = "server.stop-delay-seconds";
    public static final String KEY_UPLOAD_DIRECTORY = "upload.directory";
    public static final String KEY_MAX_UPLOAD_BYTES = "upload.max-bytes";
    public static final String KEY_BUFFER_SIZE = "upload.buffer-size";

    /**
     * 100MB 上传限制
     */
    public static final long DEFAULT_MAX_UPLOAD_BYTES = 100L << 20;

    /**
     * 默认监听端口
     */
    @Builder.Default
    private final int port = 1082;

    /**
     * 请求处理线程数
     */
    @Builder.Default
    private final int threads = 16;

    /**
     * 停止服务时等待进行中请求的秒数
     */
    @Builder.Default
    private final int stopDelaySeconds = 1;

    /**
     * 上传文件保存目录，默认为当前工作目录
     */
    @Builder.Default
    private final Path uploadDirectory = Paths.get(".");

    /**
     * 单次上传请求体上限
     */
    @Builder.Default
    private final long maxUploadBytes = DEFAULT_MAX_UPLOAD_BYTES;

    /**
     * 拷贝缓冲区大小，也是进度上报的最大滞后量
     */
    @Builder.Default
    private final int bufferSize = 64 * 1024;

    /**
     * 从 classpath 下的 landrop.properties 加载，文件缺失时使用默认值
     */
    public static TransferConfig load() {
        Properties properties = PropertiesUtil.loadIfPresent(TransferConfig.class, PropertiesUtil.TRANSFER_PROPERTIES);
        return from(Objects.requireNonNullElseGet(properties, Properties::new));
    }

    public static TransferConfig from(Properties properties) {
        TransferConfigBuilder builder = TransferConfig.builder();
        String port = lookup(properties, KEY_PORT);
        if (port != null) {
            builder.port(parsePort(port));
        }
        String threads = lookup(properties, KEY_THREADS);
        if (threads != null) {
            builder.threads(parsePositiveInt(KEY_THREADS, threads));
        }
        String stopDelay = lookup(properties, KEY_STOP_DELAY);
        if (stopDelay != null) {
            builder.stopDelaySeconds(parseNonNegativeInt(KEY_STOP_DELAY, stopDelay));
        }
        String directory = lookup(properties, KEY_UPLOAD_DIRECTORY);
        if (directory != null) {
            builder.uploadDirectory(Paths.get(directory));
        }
        String maxBytes = lookup(properties, KEY_MAX_UPLOAD_BYTES);
        if (maxBytes != null) {
            builder.maxUploadBytes(parsePositiveLong(KEY_MAX_UPLOAD_BYTES, maxBytes));
        }
        String bufferSize = lookup(properties, KEY_BUFFER_SIZE);
        if (bufferSize != null) {
            builder.bufferSize(parsePositiveInt(KEY_BUFFER_SIZE, bufferSize));
        }
        return builder.build();
    }

    /**
     * 解析端口号，0 表示由系统分配
     */
    public static int parsePort(String value) {
        int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("端口必须是数字: " + value, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口超出范围 0-65535: " + port);
        }
        return port;
    }

    private static String lookup(Properties properties, String key) {
        String value = System.getProperty(key);
        if (value == null) {
            value = properties.getProperty(key);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parsePositiveInt(String key, String value) {
        long parsed = parsePositiveLong(key, value);
        if (parsed > Integer.MAX_VALUE) {
            throw invalid(key, value);
        }
        return (int) parsed;
    }

    private static int parseNonNegativeInt(String key, String value) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0) {
                throw invalid(key, value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw invalid(key, value);
        }
    }

    private static long parsePositiveLong(String key, String value) {
        try {
            long parsed = Long.parseLong(value);
            if (parsed <= 0) {
                throw invalid(key, value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw invalid(key, value);
        }
    }

    private static IllegalStateException invalid(String key, String value) {
        return new IllegalStateException("配置项 %s 的值无效: %s".formatted(key, value));
    }

}
