package com.accountdb.bancheck.check.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public final class IdentifierNormalizer {
    private static final Pattern STEAM_ID_64 = Pattern.compile("^765\\d{14}$");

    private IdentifierNormalizer() {}

    /**
     * Trims every identifier, drops blanks and collapses duplicates, keeping the first occurrence order.
     */
    public static List<String> normalize(Collection<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            return List.of();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String identifier : identifiers) {
            if (identifier == null) {
                continue;
            }
            String trimmed = identifier.replace("\uFEFF", "").trim();
            if (!trimmed.isEmpty()) {
                distinct.add(trimmed);
            }
        }
        return new ArrayList<>(distinct);
    }

    public static boolean isSteamId64(String identifier) {
        return identifier != null && STEAM_ID_64.matcher(identifier).matches();
    }
}
