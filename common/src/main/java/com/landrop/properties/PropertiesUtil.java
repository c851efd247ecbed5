package com.landrop.properties;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * properties 工具类
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
public class PropertiesUtil {

    /**
     * 传输服务配置文件
     */
    public static final String TRANSFER_PROPERTIES = "landrop.properties";

    private PropertiesUtil() {
    }

    /**
     * 加载传输服务配置文件
     */
    public static Properties loadTransferProperties() {
        return load(PropertiesUtil.class, TRANSFER_PROPERTIES);
    }

    /**
     * 加载配置文件（通过指定类的ClassLoader），文件不存在时抛出异常
     */
    public static Properties load(Class<?> clazz, String fileName) {
        Properties properties = loadIfPresent(clazz, fileName);
        if (Objects.isNull(properties)) {
            String errorMsg = "无法找到配置文件: %s (通过类 %s 加载)".formatted(fileName, clazz.getSimpleName());
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }
        return properties;
    }

    /**
     * 加载配置文件，文件不存在时返回 null
     */
    public static Properties loadIfPresent(Class<?> clazz, String fileName) {
        log.debug("开始加载 {} 配置文件", fileName);
        try (InputStream input = clazz.getClassLoader().getResourceAsStream(fileName)) {
            if (Objects.isNull(input)) {
                return null;
            }
            Properties properties = new Properties();
            properties.load(input);
            log.info("成功加载配置文件: {}", fileName);
            return properties;
        } catch (IOException e) {
            String errorMsg = "读取配置文件失败: %s (通过类 %s 加载)".formatted(fileName, clazz.getSimpleName());
            log.error(errorMsg, e);
            throw new IllegalStateException(errorMsg, e);
        }
    }

}
