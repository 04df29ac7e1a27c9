package com.studyspots.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.GeoSpatialIndexType;
import org.springframework.data.mongodb.core.index.GeoSpatialIndexed;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Document(collection = "cafes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cafe implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    private String id;

    @NotBlank
    @Indexed
    private String name;

    @Valid
    @NotNull
    private Address address;

    @Valid
    @NotNull
    @GeoSpatialIndexed(type = GeoSpatialIndexType.GEO_2DSPHERE)
    private Location location;

    private String phone;
    private String website;
    private Map<String, String> openingHours;

    @Indexed
    private List<String> amenities;

    private String thumbnailUrl;

    @Builder.Default
    private AccessLevel wifiAccess = AccessLevel.NONE;

    @Builder.Default
    private AccessLevel outletAccessibility = AccessLevel.NONE;

    @Min(1)
    @Max(5)
    @Indexed
    @Builder.Default
    private Integer averageRating = 1;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
