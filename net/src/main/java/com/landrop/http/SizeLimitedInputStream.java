package com.landrop.http;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * 读取超过上限时抛出 {@link PayloadTooLargeException}，不依赖客户端声明的 Content-Length
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
class SizeLimitedInputStream extends FilterInputStream {

    private final long limit;

    private long count;

    SizeLimitedInputStream(InputStream in, long limit) {
        super(in);
        this.limit = limit;
    }

    @Override
    public int read() throws IOException {
        int b = in.read();
        if (b >= 0) {
            count(1);
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = in.read(b, off, len);
        if (n > 0) {
            count(n);
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        long skipped = in.skip(n);
        if (skipped > 0) {
            count(skipped);
        }
        return skipped;
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    private void count(long n) throws PayloadTooLargeException {
        count += n;
        if (count > limit) {
            throw new PayloadTooLargeException(limit);
        }
    }

}
