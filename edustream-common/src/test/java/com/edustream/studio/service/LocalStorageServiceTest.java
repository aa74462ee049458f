package com.edustream.studio.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageServiceTest {

    @TempDir
    Path root;

    @Test
    void storeFile_shouldRoundTripAndDelete() throws IOException {
        LocalStorageService storage = new LocalStorageService(root.toString());
        byte[] data = "png bytes".getBytes(StandardCharsets.UTF_8);

        String key = storage.storeFile(new ByteArrayInputStream(data), "diagram.png", data.length);

        assertTrue(key.endsWith("_diagram.png"), key);
        try (InputStream in = storage.downloadFile(key)) {
            assertArrayEquals(data, in.readAllBytes());
        }
        Path copy = root.resolve("copy.png");
        storage.downloadFileToPath(key, copy);
        assertArrayEquals(data, Files.readAllBytes(copy));

        storage.deleteFile(key);
        assertThrows(RuntimeException.class, () -> storage.downloadFile(key));
    }

    @Test
    void downloadFile_shouldRejectKeysOutsideRoot() throws IOException {
        LocalStorageService storage = new LocalStorageService(root.resolve("store").toString());

        assertThrows(IllegalArgumentException.class, () -> storage.downloadFile("../secret.txt"));
    }
}
