package com.landrop.transfer;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进行中上传的进度登记表，按客户端生成的会话 ID 索引
 * <p>
 * 上传线程写入、进度查询线程读取同一条记录，所有操作都可以并发调用。
 * 记录被移除是“传输结束”的唯一信号，无论成功还是失败。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
public class UploadSessionRegistry {

    private final Map<String, UploadProgress> sessions = new ConcurrentHashMap<>();

    /**
     * 登记新的上传会话
     *
     * @throws SessionInUseException 会话 ID 已存在
     */
    public UploadProgress begin(String sessionId, long totalSize) {
        Objects.requireNonNull(sessionId, "sessionId");
        UploadProgress progress = new UploadProgress(totalSize);
        if (sessions.putIfAbsent(sessionId, progress) != null) {
            throw new SessionInUseException(sessionId);
        }
        log.debug("Upload session {} started, total {} bytes", sessionId, totalSize);
        return progress;
    }

    /**
     * 累加已上传字节数；会话不存在时忽略
     */
    public void advance(String sessionId, long deltaBytes) {
        UploadProgress progress = sessions.get(sessionId);
        if (progress != null) {
            progress.advance(deltaBytes);
        }
    }

    public Optional<ProgressSnapshot> snapshot(String sessionId) {
        UploadProgress progress = sessions.get(sessionId);
        return progress == null ? Optional.empty() : Optional.of(progress.snapshot());
    }

    /**
     * 移除会话记录，重复调用无副作用
     */
    public void end(String sessionId) {
        if (sessionId != null && sessions.remove(sessionId) != null) {
            log.debug("Upload session {} ended", sessionId);
        }
    }

    public int activeCount() {
        return sessions.size();
    }

    public void clear() {
        sessions.clear();
    }

}
