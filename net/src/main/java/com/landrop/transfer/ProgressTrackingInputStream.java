package com.landrop.transfer;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.function.LongConsumer;

/**
 * 统计读取字节数的输入流包装
 * <p>
 * 每次读到 N 个字节后，先回调 N 再把数据交还给调用方，自身不做额外缓冲。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
public class ProgressTrackingInputStream extends FilterInputStream {

    private final LongConsumer onBytesRead;

    public ProgressTrackingInputStream(InputStream in, LongConsumer onBytesRead) {
        super(Objects.requireNonNull(in, "in"));
        this.onBytesRead = Objects.requireNonNull(onBytesRead, "onBytesRead");
    }

    /**
     * 把读取进度写入登记表中的指定会话
     */
    public static ProgressTrackingInputStream forSession(InputStream in, UploadSessionRegistry registry, String sessionId) {
        return new ProgressTrackingInputStream(in, delta -> registry.advance(sessionId, delta));
    }

    @Override
    public int read() throws IOException {
        int b = in.read();
        if (b >= 0) {
            onBytesRead.accept(1);
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = in.read(b, off, len);
        if (n > 0) {
            onBytesRead.accept(n);
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        long skipped = in.skip(n);
        if (skipped > 0) {
            onBytesRead.accept(skipped);
        }
        return skipped;
    }

    @Override
    public boolean markSupported() {
        return false;
    }

}
