package com.studyspots.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileInfoResponse {
    private long size;
    private Instant lastModified;
    private String contentType;
}
