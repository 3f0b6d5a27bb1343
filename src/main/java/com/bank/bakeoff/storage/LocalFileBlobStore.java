package com.bank.bakeoff.storage;

import com.bank.bakeoff.exception.PipelineException;
import com.bank.bakeoff.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem-backed blob store. URLs have the form {@code blob://<relative path>}.
 */
@Component
public class LocalFileBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(LocalFileBlobStore.class);
    static final String SCHEME = "blob://";

    private final Path root;

    public LocalFileBlobStore(@Value("${blob.root-dir:./data/blobs}") String rootDir) {
        this.root = Path.of(rootDir).toAbsolutePath().normalize();
    }

    @Override
    public String upload(String path, byte[] content) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            // Write-then-move so readers never see a partial object
            Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PipelineException("Failed to upload blob " + path + ": " + e.getMessage(), e);
        }
        log.debug("Uploaded blob {} ({} bytes)", path, content.length);
        return SCHEME + path;
    }

    @Override
    public byte[] download(String url) {
        Path target = resolve(toPath(url));
        try {
            return Files.readAllBytes(target);
        } catch (NoSuchFileException e) {
            throw new PipelineException("Blob not found: " + url, e);
        } catch (IOException e) {
            throw new PipelineException("Failed to read blob " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(String url) {
        Path target = resolve(toPath(url));
        try {
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new PipelineException("Failed to delete blob " + url + ": " + e.getMessage(), e);
        }
    }

    private static String toPath(String url) {
        if (url == null || !url.startsWith(SCHEME)) {
            throw new ValidationException("Unsupported blob URL: " + url);
        }
        return url.substring(SCHEME.length());
    }

    private Path resolve(String path) {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new ValidationException("Blob path escapes the storage root: " + path);
        }
        return resolved;
    }
}
