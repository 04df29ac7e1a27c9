package com.studyspots.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial user update. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateRequest {
    @Size(min = 1, max = 100)
    private String name;

    @Min(0)
    private Integer cafesVisited;

    @DecimalMin("0.0")
    @DecimalMax("5.0")
    private Double averageRating;

    @Size(min = 1)
    private String password;
}
