package com.studyspots.service.storage;

import com.studyspots.config.StudySpotsProperties;
import com.studyspots.dto.FileInfoResponse;
import com.studyspots.exception.InvalidInputException;
import com.studyspots.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;

// ========== Image Upload Service ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageUploadService {

    public static final String PHOTOS_FOLDER = "photos";
    public static final String PROFILE_PICTURES_FOLDER = "profile-pictures";

    private final BlobStorageService blobStorageService;
    private final StudySpotsProperties properties;

    public String uploadImage(String folder, MultipartFile file) {
        validate(file);
        return blobStorageService.store(folder, file);
    }

    public List<String> uploadImages(String folder, List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new InvalidInputException("No files provided");
        }
        // Reject the whole batch before anything is written
        files.forEach(this::validate);

        List<String> urls = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            urls.add(blobStorageService.store(folder, file));
        }
        log.info("Uploaded {} files to {}", urls.size(), folder);
        return urls;
    }

    public void deleteFile(String fileUrl) {
        if (fileUrl == null || fileUrl.isBlank()) {
            throw new InvalidInputException("file_url is required");
        }
        if (!blobStorageService.delete(fileUrl)) {
            throw new ResourceNotFoundException("File not found or could not be deleted");
        }
    }

    public FileInfoResponse getFileInfo(String fileUrl) {
        if (fileUrl == null || fileUrl.isBlank()) {
            throw new InvalidInputException("file_url is required");
        }
        return blobStorageService.describe(fileUrl)
            .orElseThrow(() -> new ResourceNotFoundException("File not found"));
    }

    private void validate(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidInputException("No file provided");
        }
        List<String> allowed = properties.getStorage().getAllowedContentTypes();
        String contentType = file.getContentType();
        if (contentType == null || !allowed.contains(contentType)) {
            log.warn("Rejected upload {} with content type {}", file.getOriginalFilename(), contentType);
            throw new InvalidInputException("File type " + contentType + " not allowed. Allowed types: "
                + String.join(", ", allowed));
        }
    }
}
