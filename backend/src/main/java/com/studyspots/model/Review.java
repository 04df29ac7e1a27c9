package com.studyspots.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

// ========== Review Entity ==========
@Document(collection = "reviews")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@CompoundIndex(name = "spot_created_idx", def = "{'studySpotId': 1, 'createdAt': -1}")
public class Review {
    @Id
    private String id;

    @NotBlank
    @Indexed
    private String studySpotId;

    @NotBlank
    @Indexed
    private String userId;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("5.0")
    private Double overallRating;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("5.0")
    private Double outletAccessibility;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("5.0")
    private Double wifiQuality;

    private String atmosphere;    // e.g. "Quiet"
    private String energyLevel;   // e.g. "Calm"
    private String studyFriendly; // e.g. "Very"

    @Builder.Default
    private List<Photo> photos = new ArrayList<>();

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
