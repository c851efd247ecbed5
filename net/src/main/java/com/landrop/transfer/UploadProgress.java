package com.landrop.transfer;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个上传会话的进度
 * <p>
 * 已上传字节数只增不减，且不会超过声明的总大小
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
public class UploadProgress {

    private final long totalSize;

    private final AtomicLong uploaded = new AtomicLong();

    UploadProgress(long totalSize) {
        if (totalSize < 0) {
            throw new IllegalArgumentException("totalSize must not be negative: " + totalSize);
        }
        this.totalSize = totalSize;
    }

    /**
     * 增加已上传字节数，超出总大小的部分被截断
     */
    void advance(long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("delta must not be negative: " + delta);
        }
        long current;
        long next;
        do {
            current = uploaded.get();
            next = Math.min(totalSize, current + delta);
        } while (!uploaded.compareAndSet(current, next));
    }

    public long getTotalSize() {
        return totalSize;
    }

    public long getUploaded() {
        return uploaded.get();
    }

    public ProgressSnapshot snapshot() {
        return new ProgressSnapshot(totalSize, uploaded.get());
    }

}
