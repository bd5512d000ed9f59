package com.handyhub.bookingservice.util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public final class CategoryNormalizer {

    private CategoryNormalizer() {
    }

    /**
     * Trimmed, lower-case, inner whitespace collapsed. Returns {@code null} for blank input.
     */
    public static String normalize(String category) {
        if (category == null) {
            return null;
        }
        String value = category.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return value.isEmpty() ? null : value;
    }

    public static Set<String> normalizeAll(Collection<String> categories) {
        if (categories == null) {
            return new LinkedHashSet<>();
        }
        return categories.stream()
                .map(CategoryNormalizer::normalize)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
