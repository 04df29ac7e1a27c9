package com.studyspots.service.storage;

import com.studyspots.dto.FileInfoResponse;
import org.springframework.web.multipart.MultipartFile;

import java.util.Optional;

/**
 * Opaque store for uploaded files.
 */
public interface BlobStorageService {

    /**
     * Stores the file under {@code folder} with a generated name.
     *
     * @return the public URL of the stored file
     */
    String store(String folder, MultipartFile file);

    /**
     * @return {@code false} if the URL does not point to a file held by this store
     */
    boolean delete(String fileUrl);

    Optional<FileInfoResponse> describe(String fileUrl);
}
