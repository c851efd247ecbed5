package com.landrop.address;

import com.landrop.transfer.DownloadCatalog;
import com.landrop.transfer.DownloadFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class SessionUrlBuilderTest {

    @Test
    void emptyCatalogPointsAtUploadPage() {
        SessionUrl url = SessionUrlBuilder.build("192.168.1.23", 1082, new DownloadCatalog());

        assertEquals("http://192.168.1.23:1082/", url.getUrl());
        assertEquals(SessionUrl.Target.UPLOAD, url.getTarget());
    }

    @Test
    void nonEmptyCatalogPointsAtDownloadPage() {
        DownloadCatalog catalog = new DownloadCatalog();
        catalog.add(new DownloadFile("a.txt", Paths.get("/tmp/a.txt").toAbsolutePath(), 1));

        SessionUrl url = SessionUrlBuilder.build("localhost", 8080, catalog);

        assertEquals("http://localhost:8080/download-page", url.getUrl());
        assertEquals(SessionUrl.Target.DOWNLOAD, url.getTarget());
    }
}
