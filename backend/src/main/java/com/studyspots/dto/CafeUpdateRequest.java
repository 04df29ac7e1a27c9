package com.studyspots.dto;

import com.studyspots.model.AccessLevel;
import com.studyspots.model.Address;
import com.studyspots.model.Location;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Partial cafe update. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CafeUpdateRequest {
    private String name;

    @Valid
    private Address address;

    @Valid
    private Location location;

    private String phone;
    private String website;
    private Map<String, String> openingHours;
    private List<String> amenities;
    private String thumbnailUrl;
    private AccessLevel wifiAccess;
    private AccessLevel outletAccessibility;

    @Min(1)
    @Max(5)
    private Integer averageRating;
}
