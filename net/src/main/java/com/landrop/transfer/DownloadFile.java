package com.landrop.transfer;

import lombok.Value;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 可供下载的文件
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Value
public class DownloadFile {

    /**
     * 文件名（不含路径），目录中按此名称精确查找
     */
    String displayName;

    /**
     * 选择时解析出的绝对路径
     */
    Path absolutePath;

    /**
     * 文件大小(KB)，向上取整
     */
    long sizeInKB;

    /**
     * 从本地路径创建下载文件条目
     *
     * @throws FileNotFoundException 文件不存在
     * @throws IllegalArgumentException 路径是目录
     */
    public static DownloadFile of(Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            throw new FileNotFoundException("File does not exist: " + absolute);
        }
        if (Files.isDirectory(absolute)) {
            throw new IllegalArgumentException("Expected a file but got a directory: " + absolute);
        }
        return new DownloadFile(absolute.getFileName().toString(), absolute, toKilobytes(Files.size(absolute)));
    }

    static long toKilobytes(long bytes) {
        long kb = bytes / 1024;
        if (bytes % 1024 != 0) {
            kb += 1;
        }
        return kb;
    }

}
