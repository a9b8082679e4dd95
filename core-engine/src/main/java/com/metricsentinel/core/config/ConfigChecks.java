package com.metricsentinel.core.config;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class ConfigChecks {

    private ConfigChecks() {
    }

    static void requireSources(String section, List<String> sources, List<String> errors) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < sources.size(); i++) {
            String source = sources.get(i);
            if (source == null || source.isBlank()) {
                errors.add(section + ": source at index " + i + " is blank");
            } else if (!seen.add(source)) {
                errors.add(section + ": duplicate source '" + source + "'");
            }
        }
    }
}
