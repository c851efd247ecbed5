package com.landrop.http;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 流式解析 multipart/form-data 请求体，避免一次性将整个请求加载到内存
 * <p>
 * 在缓冲区内查找 boundary，只保留可能跨越两次读取的尾部字节。
 * 目标文件字段写入临时文件，其余字段直接丢弃。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
public class MultipartFormReader {

    // ============ Multipart 协议常量 ============
    private static final String MULTIPART_FORM_DATA = "multipart/form-data";
    private static final String BOUNDARY_PARAM = "boundary=";
    private static final String CONTENT_DISPOSITION = "content-disposition";
    private static final String NAME = "name";
    private static final String FILENAME = "filename";
    private static final String FILENAME_STAR = "filename*";
    private static final byte[] CRLF = {'\r', '\n'};
    private static final int MAX_BOUNDARY_LENGTH = 70;

    // ============ 头部大小限制 ============
    private static final int MAX_HEADER_LINE = 8 * 1024;
    private static final int MAX_HEADER_LINES = 32;

    // ============ 暂存文件 ============
    private static final String SPOOL_PREFIX = "landrop-";
    private static final String SPOOL_SUFFIX = ".part";

    private final InputStream in;

    /**
     * CRLF + "--" + boundary
     */
    private final byte[] delimiter;

    private final byte[] buffer;

    private int pos;

    private int limit;

    public MultipartFormReader(InputStream in, String boundary, int bufferSize) {
        this.in = in;
        this.delimiter = ("\r\n--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
        this.buffer = new byte[Math.max(bufferSize, MAX_HEADER_LINE) + delimiter.length];
        // 第一个 boundary 前没有 CRLF，预置一个以统一查找逻辑
        buffer[0] = '\r';
        buffer[1] = '\n';
        limit = 2;
    }

    /**
     * 从 Content-Type 中提取 boundary，不是 multipart/form-data 时返回 null
     */
    public static String boundaryOf(String contentType) {
        if (contentType == null) {
            return null;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        if (!lower.trim().startsWith(MULTIPART_FORM_DATA)) {
            return null;
        }
        int idx = lower.indexOf(BOUNDARY_PARAM);
        if (idx < 0) {
            return null;
        }
        String boundary = contentType.substring(idx + BOUNDARY_PARAM.length());
        int semi = boundary.indexOf(';');
        if (semi >= 0) {
            boundary = boundary.substring(0, semi);
        }
        boundary = boundary.trim();
        if (boundary.length() >= 2 && boundary.startsWith("\"") && boundary.endsWith("\"")) {
            boundary = boundary.substring(1, boundary.length() - 1);
        }
        if (boundary.isEmpty() || boundary.length() > MAX_BOUNDARY_LENGTH) {
            return null;
        }
        return boundary;
    }

    /**
     * 读取整个请求体，返回第一个名为 fieldName 且带文件名的字段
     *
     * @param spoolDir 暂存目录，为 null 时使用系统临时目录
     * @return 没有匹配的文件字段时返回 null
     */
    public FilePart readFilePart(String fieldName, Path spoolDir) throws IOException {
        FilePart result = null;
        try {
            // 跳过前导内容和第一个 boundary
            readUntilDelimiter(OutputStream.nullOutputStream());
            while (true) {
                if (!ensure(2)) {
                    throw new MalformedMultipartException("Unexpected end of body after boundary");
                }
                if (buffer[pos] == '-' && buffer[pos + 1] == '-') {
                    // 结束标记 (--boundary--)，其后的内容忽略
                    pos += 2;
                    break;
                }
                if (buffer[pos] != '\r' || buffer[pos + 1] != '\n') {
                    throw new MalformedMultipartException("Boundary is not followed by CRLF");
                }
                pos += 2;

                Map<String, String> disposition = readPartHeaders();
                String name = disposition.get(NAME);
                String filename = resolveFilename(disposition);
                if (result == null && fieldName.equals(name) && filename != null) {
                    result = spool(name, filename, spoolDir);
                    log.debug("Spooled part {} ({}) to {}, {} bytes", name, filename, result.getSpool(), result.getSize());
                } else {
                    readUntilDelimiter(OutputStream.nullOutputStream());
                }
            }
            return result;
        } catch (IOException | RuntimeException e) {
            if (result != null) {
                Files.deleteIfExists(result.getSpool());
            }
            throw e;
        }
    }

    private FilePart spool(String name, String filename, Path spoolDir) throws IOException {
        Path spool = spoolDir == null
                ? Files.createTempFile(SPOOL_PREFIX, SPOOL_SUFFIX)
                : Files.createTempFile(spoolDir, SPOOL_PREFIX, SPOOL_SUFFIX);
        try (OutputStream out = Files.newOutputStream(spool)) {
            long size = readUntilDelimiter(out);
            return new FilePart(name, filename, spool, size);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(spool);
            throw e;
        }
    }

    /**
     * 读取字段头部（直到空行），返回 Content-Disposition 的参数
     */
    private Map<String, String> readPartHeaders() throws IOException {
        Map<String, String> disposition = Map.of();
        int lines = 0;
        while (true) {
            String line = readLine();
            if (line.isEmpty()) {
                return disposition;
            }
            if (++lines > MAX_HEADER_LINES) {
                throw new MalformedMultipartException("Too many part headers");
            }
            int colon = line.indexOf(':');
            if (colon > 0 && line.substring(0, colon).trim().equalsIgnoreCase(CONTENT_DISPOSITION)) {
                disposition = parseParameters(line.substring(colon + 1));
            }
        }
    }

    /**
     * 把 boundary 之前的数据写入 out，并越过 boundary
     *
     * @return 写入的字节数
     */
    private long readUntilDelimiter(OutputStream out) throws IOException {
        long written = 0;
        while (true) {
            int idx = indexOf(buffer, pos, limit, delimiter);
            if (idx >= 0) {
                int len = idx - pos;
                if (len > 0) {
                    out.write(buffer, pos, len);
                    written += len;
                }
                pos = idx + delimiter.length;
                return written;
            }
            // 保留可能跨越缓冲区的 boundary
            int safe = (limit - pos) - (delimiter.length - 1);
            if (safe > 0) {
                out.write(buffer, pos, safe);
                written += safe;
                pos += safe;
            }
            if (!fill()) {
                throw new MalformedMultipartException("Unexpected end of multipart body");
            }
        }
    }

    private String readLine() throws IOException {
        while (true) {
            int idx = indexOf(buffer, pos, limit, CRLF);
            if (idx >= 0) {
                String line = new String(buffer, pos, idx - pos, StandardCharsets.UTF_8);
                pos = idx + CRLF.length;
                return line;
            }
            if (limit - pos >= MAX_HEADER_LINE) {
                throw new MalformedMultipartException("Part header line too long");
            }
            if (!fill()) {
                throw new MalformedMultipartException("Unexpected end of part headers");
            }
        }
    }

    private boolean ensure(int count) throws IOException {
        while (limit - pos < count) {
            if (!fill()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 压缩缓冲区并读取下一块数据，流结束时返回 false
     */
    private boolean fill() throws IOException {
        if (pos > 0) {
            System.arraycopy(buffer, pos, buffer, 0, limit - pos);
            limit -= pos;
            pos = 0;
        }
        int n = in.read(buffer, limit, buffer.length - limit);
        if (n < 0) {
            return false;
        }
        limit += n;
        return true;
    }

    // ============ 文件名解析逻辑 ============

    /**
     * 优先使用 filename* (RFC 5987)，回退到普通 filename
     */
    static String resolveFilename(Map<String, String> disposition) {
        String extended = disposition.get(FILENAME_STAR);
        if (extended != null) {
            String decoded = decodeRfc5987(extended);
            if (decoded != null) {
                return decoded;
            }
        }
        return disposition.get(FILENAME);
    }

    private static String decodeRfc5987(String value) {
        int q = value.indexOf("''");
        String charset = StandardCharsets.UTF_8.name();
        String encoded = value;
        if (q > 0) {
            charset = value.substring(0, q);
            encoded = value.substring(q + 2);
        } else if (q == 0) {
            encoded = value.substring(2);
        }
        try {
            // RFC 5987 中 '+' 不表示空格
            return URLDecoder.decode(encoded.replace("+", "%2B"), charset);
        } catch (UnsupportedEncodingException | IllegalArgumentException e) {
            log.debug("Ignoring undecodable filename* value: {}", value);
            return null;
        }
    }

    /**
     * 解析形如 {@code form-data; name="file"; filename="a.txt"} 的参数，键统一为小写
     */
    static Map<String, String> parseParameters(String value) {
        Map<String, String> params = new HashMap<>();
        int n = value.length();
        int i = value.indexOf(';');
        if (i < 0) {
            return params;
        }
        i++;
        while (i < n) {
            while (i < n && isWhitespace(value.charAt(i))) {
                i++;
            }
            int eq = value.indexOf('=', i);
            int semi = value.indexOf(';', i);
            if (eq < 0 || (semi >= 0 && semi < eq)) {
                i = semi < 0 ? n : semi + 1;
                continue;
            }
            String key = value.substring(i, eq).trim().toLowerCase(Locale.ROOT);
            i = eq + 1;
            while (i < n && isWhitespace(value.charAt(i))) {
                i++;
            }
            StringBuilder sb = new StringBuilder();
            if (i < n && value.charAt(i) == '"') {
                i++;
                while (i < n && value.charAt(i) != '"') {
                    char c = value.charAt(i);
                    // 只把 \" 和 \\ 视为转义，保留 Windows 路径中的反斜杠
                    if (c == '\\' && i + 1 < n && (value.charAt(i + 1) == '"' || value.charAt(i + 1) == '\\')) {
                        i++;
                        c = value.charAt(i);
                    }
                    sb.append(c);
                    i++;
                }
                i++;
            } else {
                int end = semi < 0 ? n : semi;
                sb.append(value.substring(i, end).trim());
                i = end;
            }
            params.putIfAbsent(key, sb.toString());
            int next = i < n ? value.indexOf(';', i) : -1;
            i = next < 0 ? n : next + 1;
        }
        return params;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t';
    }

    private static int indexOf(byte[] data, int from, int to, byte[] target) {
        byte first = target[0];
        int max = to - target.length;
        outer:
        for (int i = from; i <= max; i++) {
            if (data[i] != first) {
                continue;
            }
            for (int j = 1; j < target.length; j++) {
                if (data[i + j] != target[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

}
