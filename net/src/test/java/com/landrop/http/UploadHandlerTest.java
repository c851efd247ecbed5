package com.landrop.http;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UploadHandlerTest {

    @Test
    void basenameStripsClientPaths() {
        assertEquals("photo.jpg", UploadHandler.safeBasename("photo.jpg"));
        assertEquals("photo.jpg", UploadHandler.safeBasename("/sdcard/DCIM/photo.jpg"));
        assertEquals("notes.txt", UploadHandler.safeBasename("C:\\Users\\me\\notes.txt"));
        assertEquals("passwd", UploadHandler.safeBasename("../../etc/passwd"));
    }

    @Test
    void unusableNamesAreRejected() {
        for (String name : new String[]{"", "   ", ".", "..", "dir/", "a/..", "bad\0name", null}) {
            HttpStatusException e = assertThrows(HttpStatusException.class, () -> UploadHandler.safeBasename(name),
                    "expected rejection of " + name);
            assertEquals(400, e.getStatus());
        }
    }
}
