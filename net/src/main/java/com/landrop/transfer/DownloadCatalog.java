package com.landrop.transfer;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 待下载文件目录
 * <p>
 * 只追加，按加入顺序展示；读取可与请求线程并发进行。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
public class DownloadCatalog {

    private final List<DownloadFile> files = new CopyOnWriteArrayList<>();

    public void add(DownloadFile file) {
        files.add(Objects.requireNonNull(file, "file"));
        log.info("Added to download catalog: {} ({} KB)", file.getDisplayName(), file.getSizeInKB());
    }

    public DownloadFile addPath(Path path) throws IOException {
        DownloadFile file = DownloadFile.of(path);
        add(file);
        return file;
    }

    /**
     * 当前目录的不可变快照
     */
    public List<DownloadFile> list() {
        return List.copyOf(files);
    }

    /**
     * 按文件名精确查找（区分大小写）
     */
    public Optional<DownloadFile> find(String displayName) {
        if (displayName == null) {
            return Optional.empty();
        }
        for (DownloadFile file : files) {
            if (file.getDisplayName().equals(displayName)) {
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int size() {
        return files.size();
    }

}
