package com.landrop.http;

import com.landrop.transfer.ProgressTrackingInputStream;
import com.landrop.transfer.SessionInUseException;
import com.landrop.transfer.UploadSessionRegistry;
import com.sun.net.httpserver.HttpExchange;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 文件上传接口
 * <p>
 * 请求体先暂存，再经过进度统计流写入保存目录。无论成功失败，会话记录都会被移除。
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Slf4j
class UploadHandler extends HandlerSupport {

    static final String UPLOAD_ID_PARAM = "uploadId";
    static final String FILE_FIELD = "file";

    private final UploadSessionRegistry registry;

    private final Path uploadDirectory;

    private final long maxUploadBytes;

    private final int bufferSize;

    UploadHandler(UploadSessionRegistry registry, Path uploadDirectory, long maxUploadBytes, int bufferSize) {
        this.registry = registry;
        this.uploadDirectory = uploadDirectory.toAbsolutePath().normalize();
        this.maxUploadBytes = maxUploadBytes;
        this.bufferSize = bufferSize;
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws IOException {
        long startTime = System.currentTimeMillis();

        requireMethod(exchange, HTTP_POST);
        String uploadId = requireParam(exchange, UPLOAD_ID_PARAM);
        String boundary = MultipartFormReader.boundaryOf(exchange.getRequestHeaders().getFirst(HEADER_CONTENT_TYPE));
        if (boundary == null) {
            throw new HttpStatusException(STATUS_BAD_REQUEST, "Expected multipart/form-data with a boundary");
        }
        long declaredLength = declaredContentLength(exchange);
        if (declaredLength > maxUploadBytes) {
            throw new HttpStatusException(STATUS_PAYLOAD_TOO_LARGE, "Request body exceeds " + maxUploadBytes + " bytes");
        }

        FilePart part = readFilePart(exchange, boundary);
        try {
            String filename = safeBasename(part.getFilename());
            Path target = uploadDirectory.resolve(filename);

            try {
                registry.begin(uploadId, part.getSize());
            } catch (SessionInUseException e) {
                throw new HttpStatusException(STATUS_CONFLICT, e.getMessage());
            }
            long written;
            try {
                written = copy(part.getSpool(), target, uploadId);
            } catch (IOException e) {
                log.error("Saving upload {} to {} failed", uploadId, target, e);
                throw new HttpStatusException(STATUS_INTERNAL_ERROR, "Failed to save file: " + e.getMessage());
            } finally {
                registry.end(uploadId);
            }
            double elapsedSeconds = (System.currentTimeMillis() - startTime) / 1000.0;
            log.info("Saved: {} ({} bytes) in {} seconds", target, written, String.format("%.2f", elapsedSeconds));
            sendText(exchange, STATUS_OK, "Uploaded: " + filename);
        } finally {
            Files.deleteIfExists(part.getSpool());
        }
    }

    private FilePart readFilePart(HttpExchange exchange, String boundary) throws IOException {
        FilePart part;
        try (InputStream body = new SizeLimitedInputStream(exchange.getRequestBody(), maxUploadBytes)) {
            part = new MultipartFormReader(body, boundary, bufferSize).readFilePart(FILE_FIELD, null);
        } catch (PayloadTooLargeException e) {
            throw new HttpStatusException(STATUS_PAYLOAD_TOO_LARGE, e.getMessage());
        } catch (MalformedMultipartException e) {
            throw new HttpStatusException(STATUS_BAD_REQUEST, "Malformed multipart body: " + e.getMessage());
        }
        if (part == null) {
            throw new HttpStatusException(STATUS_BAD_REQUEST, "Missing multipart field: " + FILE_FIELD);
        }
        return part;
    }

    /**
     * 经过进度统计流把暂存文件写入目标位置
     */
    private long copy(Path spool, Path target, String uploadId) throws IOException {
        byte[] buffer = new byte[bufferSize];
        long written = 0;
        try (InputStream in = ProgressTrackingInputStream.forSession(Files.newInputStream(spool), registry, uploadId);
             OutputStream out = Files.newOutputStream(target)) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                out.write(buffer, 0, n);
                written += n;
            }
        }
        return written;
    }

    /**
     * 只保留文件名部分，不允许客户端指定路径
     */
    static String safeBasename(String filename) {
        String name = filename == null ? "" : filename;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = name.trim();
        if (name.isEmpty() || ".".equals(name) || "..".equals(name) || name.indexOf('\0') >= 0) {
            throw new HttpStatusException(STATUS_BAD_REQUEST, "Invalid file name: " + filename);
        }
        return name;
    }

    private static long declaredContentLength(HttpExchange exchange) {
        String value = exchange.getRequestHeaders().getFirst(HEADER_CONTENT_LENGTH);
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new HttpStatusException(STATUS_BAD_REQUEST, "Invalid Content-Length: " + value);
        }
    }

}
