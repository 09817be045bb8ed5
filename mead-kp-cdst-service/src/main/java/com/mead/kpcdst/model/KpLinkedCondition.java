package com.mead.kpcdst.model;

public record KpLinkedCondition(
        String name,
        double annualBurdenBillions,
        String kpLink,
        double riskHazardRatio,
        EvidenceGrade evidence
) {}
