package com.mead.kpcdst.model;

public enum Metabolite {
    TRP,
    KYN;

    public static Metabolite fromLabel(String label) {
        for (Metabolite metabolite : values()) {
            if (metabolite.name().equalsIgnoreCase(label)) return metabolite;
        }
        throw new IllegalArgumentException("Unknown metabolite: " + label);
    }
}
