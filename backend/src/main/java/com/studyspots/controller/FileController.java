package com.studyspots.controller;

import com.studyspots.dto.FileInfoResponse;
import com.studyspots.dto.FileUploadResponse;
import com.studyspots.service.storage.ImageUploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

// ========== File Controller ==========
@RestController
@RequestMapping("/files")
@RequiredArgsConstructor
@Tag(name = "Files", description = "Image uploads")
public class FileController {

    private final ImageUploadService imageUploadService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload an image")
    public ResponseEntity<FileUploadResponse> uploadFile(@RequestParam("file") MultipartFile file) {
        String url = imageUploadService.uploadImage(ImageUploadService.PHOTOS_FOLDER, file);
        return ResponseEntity.ok(FileUploadResponse.of(List.of(url)));
    }

    @PostMapping(value = "/upload-multiple", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload several images")
    public ResponseEntity<FileUploadResponse> uploadMultipleFiles(@RequestParam("files") List<MultipartFile> files) {
        return ResponseEntity.ok(FileUploadResponse.of(
            imageUploadService.uploadImages(ImageUploadService.PHOTOS_FOLDER, files)));
    }

    @GetMapping("/info")
    @Operation(summary = "Get size, modification time and content type of an uploaded file")
    public ResponseEntity<FileInfoResponse> getFileInfo(@RequestParam("file_url") String fileUrl) {
        return ResponseEntity.ok(imageUploadService.getFileInfo(fileUrl));
    }

    @DeleteMapping("/delete")
    @Operation(summary = "Delete an uploaded file by its URL")
    public ResponseEntity<Void> deleteFile(@RequestParam("file_url") String fileUrl) {
        imageUploadService.deleteFile(fileUrl);
        return ResponseEntity.noContent().build();
    }
}
