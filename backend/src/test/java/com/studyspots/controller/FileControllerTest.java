package com.studyspots.controller;

import com.studyspots.dto.FileInfoResponse;
import com.studyspots.exception.InvalidInputException;
import com.studyspots.exception.ResourceNotFoundException;
import com.studyspots.service.storage.ImageUploadService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FileController.class)
@AutoConfigureMockMvc(addFilters = false)
class FileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ImageUploadService imageUploadService;

    @Test
    void uploadReturnsSingleUrl() throws Exception {
        when(imageUploadService.uploadImage(eq(ImageUploadService.PHOTOS_FOLDER), any()))
            .thenReturn("http://localhost:8000/static/photos/a.png");

        mockMvc.perform(multipart("/files/upload")
                .file(new MockMultipartFile("file", "a.png", "image/png", new byte[] {1})))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("File uploaded successfully"))
            .andExpect(jsonPath("$.file_urls[0]").value("http://localhost:8000/static/photos/a.png"))
            .andExpect(jsonPath("$.count").value(1));
    }

    @Test
    void uploadMultipleReturnsAllUrls() throws Exception {
        when(imageUploadService.uploadImages(eq(ImageUploadService.PHOTOS_FOLDER), anyList()))
            .thenReturn(List.of("http://x/1.png", "http://x/2.png"));

        mockMvc.perform(multipart("/files/upload-multiple")
                .file(new MockMultipartFile("files", "1.png", "image/png", new byte[] {1}))
                .file(new MockMultipartFile("files", "2.png", "image/png", new byte[] {2})))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Files uploaded successfully"))
            .andExpect(jsonPath("$.count").value(2));
    }

    @Test
    void uploadRejectedTypeReturns400() throws Exception {
        when(imageUploadService.uploadImage(eq(ImageUploadService.PHOTOS_FOLDER), any()))
            .thenThrow(new InvalidInputException("File type text/plain not allowed"));

        mockMvc.perform(multipart("/files/upload")
                .file(new MockMultipartFile("file", "a.txt", "text/plain", new byte[] {1})))
            .andExpect(status().isBadRequest());
    }

    @Test
    void infoReturnsSnakeCaseMetadata() throws Exception {
        when(imageUploadService.getFileInfo("http://x/1.png"))
            .thenReturn(new FileInfoResponse(1024, Instant.parse("2024-01-15T10:30:00Z"), "image/png"));

        mockMvc.perform(get("/files/info").param("file_url", "http://x/1.png"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.size").value(1024))
            .andExpect(jsonPath("$.last_modified").value("2024-01-15T10:30:00Z"))
            .andExpect(jsonPath("$.content_type").value("image/png"));
    }

    @Test
    void infoForUnknownFileReturns404() throws Exception {
        when(imageUploadService.getFileInfo("http://x/gone.png"))
            .thenThrow(new ResourceNotFoundException("File not found"));

        mockMvc.perform(get("/files/info").param("file_url", "http://x/gone.png"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.detail").value("File not found"));
    }

    @Test
    void deleteByUrlReturns204() throws Exception {
        mockMvc.perform(delete("/files/delete").param("file_url", "http://x/1.png"))
            .andExpect(status().isNoContent());
        verify(imageUploadService).deleteFile("http://x/1.png");
    }
}
