package com.edustream.studio.service;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Storage backend for generated artifacts. Keys returned by {@link #storeFile} are what
 * content items keep as their diagram/audio/video references.
 */
public interface FileStorageService {
    String storeFile(InputStream inputStream, String filename, long contentLength);
    InputStream downloadFile(String key);
    void downloadFileToPath(String key, Path destination);
    void deleteFile(String key);
}
