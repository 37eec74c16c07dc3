package com.enterprise.channelnotification.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Kinds of change a subscription is notified about.
 * On the wire Graph expects a comma separated list, e.g. "created,deleted,updated".
 */
public enum ChangeType {
    CREATED,
    DELETED,
    UPDATED;
    
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    public static String toWireValue(Collection<ChangeType> changeTypes) {
        return changeTypes.stream()
            .sorted()
            .map(ChangeType::wireValue)
            .collect(Collectors.joining(","));
    }
    
    public static Set<ChangeType> fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return EnumSet.noneOf(ChangeType.class);
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .map(s -> s.toUpperCase(Locale.ROOT))
            .filter(ChangeType::isKnown)
            .map(ChangeType::valueOf)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(ChangeType.class)));
    }
    
    // Graph also knows change types this service never requests
    private static boolean isKnown(String name) {
        return Arrays.stream(values()).anyMatch(type -> type.name().equals(name));
    }
}
