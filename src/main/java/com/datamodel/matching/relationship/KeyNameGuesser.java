package com.datamodel.matching.relationship;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the attribute most likely to be an entity's key column.
 * Ranking: ends with {@code _id}, equals {@code id}, ends with {@code id}, anything
 * else; ties go to the shorter name, then to list order.
 */
public class KeyNameGuesser {

    private static final Comparator<String> BY_KEY_LIKELIHOOD =
            Comparator.comparingInt(KeyNameGuesser::rank).thenComparingInt(String::length);

    public Optional<String> guess(List<String> attributeNames) {
        if (attributeNames == null) {
            return Optional.empty();
        }
        List<String> names = new ArrayList<>();
        for (String name : attributeNames) {
            if (name != null && !name.isEmpty()) {
                names.add(name);
            }
        }
        // Stream.min keeps the first of equal elements
        return names.stream().min(BY_KEY_LIKELIHOOD);
    }

    static int rank(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith("_id")) {
            return 0;
        }
        if (lower.equals("id")) {
            return 1;
        }
        if (lower.endsWith("id")) {
            return 2;
        }
        return 3;
    }
}
