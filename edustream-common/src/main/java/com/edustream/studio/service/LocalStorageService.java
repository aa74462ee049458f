package com.edustream.studio.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "local", matchIfMissing = true)
public class LocalStorageService implements FileStorageService {

    private final Path rootLocation;

    public LocalStorageService(@Value("${app.storage.local-root:data/storage}") String root) throws IOException {
        this.rootLocation = Paths.get(root).toAbsolutePath();
        Files.createDirectories(rootLocation);
    }

    @Override
    public String storeFile(InputStream inputStream, String filename, long contentLength) {
        String key = UUID.randomUUID() + "_" + filename;
        try {
            Path destinationFile = resolve(key);
            Files.copy(inputStream, destinationFile, StandardCopyOption.REPLACE_EXISTING);
            return key;
        } catch (IOException e) {
            throw new RuntimeException("Failed to store file " + filename, e);
        }
    }

    @Override
    public InputStream downloadFile(String key) {
        try {
            return Files.newInputStream(existing(key));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read file " + key, e);
        }
    }

    @Override
    public void downloadFileToPath(String key, Path destination) {
        try {
            Files.copy(existing(key), destination, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RuntimeException("Failed to copy file " + key, e);
        }
    }

    @Override
    public void deleteFile(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete file " + key, e);
        }
    }

    private Path existing(String key) {
        Path file = resolve(key);
        if (!Files.exists(file)) {
            throw new RuntimeException("File not found: " + key);
        }
        return file;
    }

    private Path resolve(String key) {
        Path file = rootLocation.resolve(key).normalize();
        if (!file.startsWith(rootLocation)) {
            throw new IllegalArgumentException("Invalid storage key: " + key);
        }
        return file;
    }
}
