package com.studyspots.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Location implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    private String type = "Point";

    @NotNull
    @Size(min = 2, max = 2)
    private List<Double> coordinates; // [longitude, latitude]

    public static Location of(double longitude, double latitude) {
        return Location.builder()
            .coordinates(List.of(longitude, latitude))
            .build();
    }
}
