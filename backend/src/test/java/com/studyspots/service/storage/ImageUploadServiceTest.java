package com.studyspots.service.storage;

import com.studyspots.config.StudySpotsProperties;
import com.studyspots.exception.InvalidInputException;
import com.studyspots.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImageUploadServiceTest {

    @Mock
    private BlobStorageService blobStorageService;

    private ImageUploadService imageUploadService;

    @BeforeEach
    void setUp() {
        imageUploadService = new ImageUploadService(blobStorageService, new StudySpotsProperties());
    }

    @Test
    void uploadImageStoresAllowedType() {
        MockMultipartFile file = image("a.jpg", "image/jpeg");
        when(blobStorageService.store("photos", file)).thenReturn("http://localhost:8000/static/photos/x.jpg");

        assertThat(imageUploadService.uploadImage(ImageUploadService.PHOTOS_FOLDER, file))
            .isEqualTo("http://localhost:8000/static/photos/x.jpg");
    }

    @Test
    void uploadImageRejectsNonImage() {
        assertThatThrownBy(() -> imageUploadService.uploadImage("photos", image("notes.txt", "text/plain")))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageStartingWith("File type text/plain not allowed");
        verifyNoInteractions(blobStorageService);
    }

    @Test
    void uploadImageRejectsEmptyFile() {
        MockMultipartFile empty = new MockMultipartFile("file", "a.png", "image/png", new byte[0]);

        assertThatThrownBy(() -> imageUploadService.uploadImage("photos", empty))
            .isInstanceOf(InvalidInputException.class)
            .hasMessage("No file provided");
    }

    @Test
    void uploadImagesStoresNothingWhenOneFileIsInvalid() {
        List<MultipartFile> files = List.of(image("a.png", "image/png"), image("b.pdf", "application/pdf"));

        assertThatThrownBy(() -> imageUploadService.uploadImages("photos", files))
            .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(blobStorageService);
    }

    @Test
    void deleteFileReportsMissingFile() {
        when(blobStorageService.delete("http://localhost:8000/static/photos/gone.png")).thenReturn(false);

        assertThatThrownBy(() -> imageUploadService.deleteFile("http://localhost:8000/static/photos/gone.png"))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void getFileInfoReportsMissingFile() {
        when(blobStorageService.describe("http://localhost:8000/static/photos/gone.png")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> imageUploadService.getFileInfo("http://localhost:8000/static/photos/gone.png"))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("File not found");
    }

    @Test
    void getFileInfoRequiresUrl() {
        assertThatThrownBy(() -> imageUploadService.getFileInfo(" "))
            .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(blobStorageService);
    }

    private static MockMultipartFile image(String name, String contentType) {
        return new MockMultipartFile("file", name, contentType, new byte[] {1, 2, 3});
    }
}
