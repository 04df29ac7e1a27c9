package com.studyspots.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial review update. Null fields are left unchanged; rating ranges are
 * checked by the service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewUpdateRequest {
    private Double overallRating;
    private Double outletAccessibility;
    private Double wifiQuality;
    private String atmosphere;
    private String energyLevel;
    private String studyFriendly;
}
