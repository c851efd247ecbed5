package com.landrop.http;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MultipartFormReaderTest {

    @TempDir
    Path spoolDir;

    @Test
    void extractsBoundaryFromContentType() {
        assertEquals("abc", MultipartFormReader.boundaryOf("multipart/form-data; boundary=abc"));
        assertEquals("a b", MultipartFormReader.boundaryOf("Multipart/Form-Data; boundary=\"a b\"; charset=utf-8"));
        assertNull(MultipartFormReader.boundaryOf("application/json"));
        assertNull(MultipartFormReader.boundaryOf("multipart/form-data"));
        assertNull(MultipartFormReader.boundaryOf(null));
    }

    @Test
    void spoolsFileFieldAndSkipsOthers() throws IOException {
        byte[] content = randomBytes(300_000);
        byte[] body = MultipartBodies.builder()
                .field("note", "hello")
                .file("other", "ignored.bin", new byte[]{1, 2, 3})
                .file("file", "photo.jpg", content)
                .build();

        FilePart part = read(body, 4096);

        assertEquals("file", part.getFieldName());
        assertEquals("photo.jpg", part.getFilename());
        assertEquals(content.length, part.getSize());
        assertArrayEquals(content, Files.readAllBytes(part.getSpool()));
        assertEquals(spoolDir, part.getSpool().getParent());
    }

    @Test
    void contentContainingCrlfAndDashesIsPreserved() throws IOException {
        byte[] content = ("line1\r\n--not-a-boundary\r\n--" + "\r\n").getBytes(StandardCharsets.UTF_8);
        byte[] body = MultipartBodies.builder().file("file", "tricky.txt", content).build();

        FilePart part = read(body, 16);

        assertArrayEquals(content, Files.readAllBytes(part.getSpool()));
    }

    @Test
    void emptyFileHasZeroSize() throws IOException {
        byte[] body = MultipartBodies.builder().file("file", "empty.txt", new byte[0]).build();

        FilePart part = read(body, 1024);

        assertEquals(0, part.getSize());
        assertEquals(0, Files.size(part.getSpool()));
    }

    @Test
    void missingFileFieldReturnsNull() throws IOException {
        byte[] body = MultipartBodies.builder().field("file", "not a file upload").build();

        assertNull(read(body, 1024));
    }

    @Test
    void truncatedBodyIsMalformedAndLeavesNoSpool() throws IOException {
        byte[] body = MultipartBodies.builder().file("file", "cut.bin", randomBytes(5000)).buildTruncated();
        byte[] cut = java.util.Arrays.copyOf(body, body.length - 10);

        assertThrows(MalformedMultipartException.class, () -> read(cut, 1024));
        try (var files = Files.list(spoolDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void utf8AndExtendedFilenamesAreDecoded() throws IOException {
        byte[] body = MultipartBodies.builder().file("file", "报告 2026.pdf", new byte[]{9}).build();
        assertEquals("报告 2026.pdf", read(body, 1024).getFilename());

        byte[] extended = MultipartBodies.builder()
                .fileWithDisposition("form-data; name=\"file\"; filename=\"fallback.txt\"; filename*=UTF-8''na%C3%AFve+1.txt",
                        new byte[]{9})
                .build();
        assertEquals("naïve+1.txt", read(extended, 1024).getFilename());
    }

    @Test
    void parsesQuotedParameters() {
        Map<String, String> params = MultipartFormReader.parseParameters(
                "form-data; name=\"file\"; filename=\"a; b \\\"c\\\".txt\"");
        assertEquals("file", params.get("name"));
        assertEquals("a; b \"c\".txt", params.get("filename"));

        Map<String, String> windowsPath = MultipartFormReader.parseParameters(
                "form-data; name=file; filename=\"C:\\Users\\me\\notes.txt\"");
        assertEquals("file", windowsPath.get("name"));
        assertEquals("C:\\Users\\me\\notes.txt", windowsPath.get("filename"));
    }

    private FilePart read(byte[] body, int bufferSize) throws IOException {
        return new MultipartFormReader(new ByteArrayInputStream(body), MultipartBodies.BOUNDARY, bufferSize)
                .readFilePart("file", spoolDir);
    }

    private static byte[] randomBytes(int size) {
        byte[] data = new byte[size];
        new Random(42).nextBytes(data);
        return data;
    }
}
