package com.mead.kpcdst.model;

public enum DementiaRiskLevel {
    POPULATION_LEVEL,
    MODERATE,
    ELEVATED,
    CRITICAL
}
