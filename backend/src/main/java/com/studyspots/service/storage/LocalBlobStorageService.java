package com.studyspots.service.storage;

import com.studyspots.config.StudySpotsProperties;
import com.studyspots.dto.FileInfoResponse;
import com.studyspots.exception.InvalidInputException;
import com.studyspots.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
public class LocalBlobStorageService implements BlobStorageService {

    private final Path root;
    private final String publicBaseUrl;

    public LocalBlobStorageService(StudySpotsProperties properties) {
        this.root = Paths.get(properties.getStorage().getRoot()).toAbsolutePath().normalize();
        this.publicBaseUrl = stripTrailingSlash(properties.getStorage().getPublicBaseUrl());
    }

    @Override
    @Retryable(
        retryFor = StorageException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 200, multiplier = 2.0)
    )
    public String store(String folder, MultipartFile file) {
        String extension = StringUtils.getFilenameExtension(file.getOriginalFilename());
        String filename = StringUtils.hasText(extension)
            ? UUID.randomUUID() + "." + extension.toLowerCase()
            : UUID.randomUUID().toString();

        Path target = resolveInsideRoot(folder + "/" + filename);
        if (target == null) {
            throw new InvalidInputException("Invalid storage folder: " + folder);
        }
        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Failed to write {}: {}", target, e.getMessage());
            throw new StorageException("Failed to store file", e);
        }

        String url = publicBaseUrl + "/" + folder + "/" + filename;
        log.info("Stored file {} ({} bytes) at {}", file.getOriginalFilename(), file.getSize(), url);
        return url;
    }

    @Override
    public boolean delete(String fileUrl) {
        Path target = resolveUrl(fileUrl);
        if (target == null) {
            return false;
        }
        try {
            boolean deleted = Files.deleteIfExists(target);
            if (deleted) {
                log.info("Deleted file {}", fileUrl);
            }
            return deleted;
        } catch (IOException e) {
            throw new StorageException("Failed to delete file", e);
        }
    }

    @Override
    public Optional<FileInfoResponse> describe(String fileUrl) {
        Path target = resolveUrl(fileUrl);
        if (target == null || !Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            String contentType = MediaTypeFactory.getMediaType(target.getFileName().toString())
                .map(MediaType::toString)
                .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
            return Optional.of(new FileInfoResponse(
                Files.size(target),
                Files.getLastModifiedTime(target).toInstant(),
                contentType));
        } catch (IOException e) {
            throw new StorageException("Failed to read file metadata", e);
        }
    }

    private Path resolveUrl(String fileUrl) {
        if (fileUrl == null || !fileUrl.startsWith(publicBaseUrl + "/")) {
            return null;
        }
        return resolveInsideRoot(fileUrl.substring(publicBaseUrl.length() + 1));
    }

    // Returns null when the relative path escapes the storage root
    private Path resolveInsideRoot(String relative) {
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            log.warn("Rejected storage path outside root: {}", relative);
            return null;
        }
        return resolved;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
