package com.example.hostguard.registry.source;

import java.util.Locale;

/**
 * Infers an environment from a group or tag name.
 */
public final class EnvironmentClassifier {

    private EnvironmentClassifier() {}

    public static String fromGroupName(String group) {
        if (group == null) return null;
        String lower = group.toLowerCase(Locale.ROOT);
        if (lower.contains("prod")) return "production";
        if (lower.contains("stag")) return "staging";
        if (lower.contains("dev")) return "development";
        return null;
    }
}
