package com.studyspots.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileUploadResponse {
    private String message;
    private List<String> fileUrls;
    private int count;

    public static FileUploadResponse of(List<String> urls) {
        String message = urls.size() == 1 ? "File uploaded successfully" : "Files uploaded successfully";
        return new FileUploadResponse(message, urls, urls.size());
    }
}
