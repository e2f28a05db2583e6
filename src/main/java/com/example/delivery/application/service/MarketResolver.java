package com.example.delivery.application.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives the market an order belongs to from its zip code.
 * <p>
 * Configured as {@code delivery.markets} entries of the form {@code <zip-prefix>:<market-id>};
 * the longest matching prefix wins.
 */
@Component
public class MarketResolver {

    private final Map<String, Integer> marketsByZipPrefix;

    public MarketResolver(@Value("${delivery.markets:}") String[] entries) {
        Map<String, Integer> parsed = new LinkedHashMap<>();
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String[] parts = entry.trim().split(":");
            if (parts.length != 2 || parts[0].isBlank()) {
                throw new IllegalArgumentException("Invalid market entry '" + entry + "', expected <zip-prefix>:<market-id>");
            }
            parsed.put(parts[0].trim(), Integer.valueOf(parts[1].trim()));
        }
        this.marketsByZipPrefix = parsed;
    }

    /**
     * @param zip the delivery zip code
     * @return the market id, or null when no prefix matches
     */
    public Integer marketIdFor(String zip) {
        if (zip == null || zip.isBlank()) {
            return null;
        }
        return marketsByZipPrefix.entrySet().stream()
                .filter(entry -> zip.startsWith(entry.getKey()))
                .max(Comparator.comparingInt(entry -> entry.getKey().length()))
                .map(Map.Entry::getValue)
                .orElse(null);
    }
}
