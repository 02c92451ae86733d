package com.missingtable.sync.util;

public class NameNormalizer {
    public static String normalize(String name) {
        if (name == null) return null;
        return name.trim()
                .replaceAll("\\s+", " ")
                .toLowerCase();
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
