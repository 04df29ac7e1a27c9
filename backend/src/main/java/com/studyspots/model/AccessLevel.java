package com.studyspots.model;

public enum AccessLevel {
    NONE,
    POOR,
    FAIR,
    EXCELLENT
}
