package com.example.skillsmatrix.service.staging;

import java.util.EnumMap;
import java.util.Map;

public enum Bucket {
    BASIC_INFORMATION("Basic Information"),
    INDUSTRY_EXPERIENCE("Industry Experience"),
    DOMAINS("Domains"),
    STANDARDS("Standards"),
    SKILLS("Skills"),
    LANGUAGES("Languages"),
    TOOLS("Tools");

    private final String label;

    Bucket(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EnumMap<Bucket, String> copyOf(Map<Bucket, String> values) {
        EnumMap<Bucket, String> copy = new EnumMap<>(Bucket.class);
        copy.putAll(values);
        return copy;
    }

    public boolean isCategory() {
        return this != BASIC_INFORMATION;
    }
}
