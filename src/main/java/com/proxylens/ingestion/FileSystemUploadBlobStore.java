package com.proxylens.ingestion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * Upload blobs stored as files named after the upload id in one directory.
 */
@Component
public class FileSystemUploadBlobStore implements UploadBlobStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemUploadBlobStore.class);

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._\\-]{1,128}");

    private final Path root;

    public FileSystemUploadBlobStore(@Value("${proxylens.uploads.dir:./data/uploads}") String directory) {
        this.root = Paths.get(directory).toAbsolutePath().normalize();
        log.info("Reading uploads from {}", root);
    }

    @Override
    public InputStream open(String uploadId) throws IOException {
        if (uploadId == null || !SAFE_ID.matcher(uploadId).matches() || uploadId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid upload id: " + uploadId);
        }
        Path file = root.resolve(uploadId).normalize();
        if (!file.startsWith(root) || !Files.isRegularFile(file)) {
            throw new FileNotFoundException("Upload not found: " + uploadId);
        }
        return Files.newInputStream(file);
    }
}
