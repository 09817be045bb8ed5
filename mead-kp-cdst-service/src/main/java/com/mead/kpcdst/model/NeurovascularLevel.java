package com.mead.kpcdst.model;

public enum NeurovascularLevel {
    LOW,
    MODERATE,
    HIGH
}
