package com.realestate.spatial.domain.service;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a listing's free-text location into a geocoder query.
 *
 * Rule: comma segments that are only administrative qualifiers ("okres X",
 * "X kraj", "... district", "... region") are dropped; of the rest the first
 * segment is used, unless it looks like "street + house number" and another
 * segment follows, in which case the next one (usually the municipality) is
 * used.
 */
@Service
public class LocationQueryHeuristic {

    private static final Pattern HOUSE_NUMBER_SUFFIX = Pattern.compile("\\s+\\d+[a-zA-Z]?(/\\d+[a-zA-Z]?)?\\s*$");
    private static final Pattern QUALIFIER_PREFIX = Pattern.compile("^(okres|district|region)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUALIFIER_SUFFIX = Pattern.compile("\\s+(kraj|district|region)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @return the query string, empty when nothing usable remains
     */
    public String toQuery(String locationText) {
        if (locationText == null || locationText.isBlank()) {
            return "";
        }

        List<String> segments = new ArrayList<>();
        Arrays.stream(locationText.split(","))
                .map(segment -> WHITESPACE.matcher(segment.trim()).replaceAll(" "))
                .filter(segment -> !segment.isEmpty())
                .forEach(segments::add);
        if (segments.isEmpty()) {
            return "";
        }

        List<String> places = segments.stream()
                .filter(segment -> !isQualifier(segment))
                .toList();
        if (places.isEmpty()) {
            // only qualifiers: "okres Kolín" still names a place
            return stripQualifier(segments.get(0));
        }

        String first = places.get(0);
        if (places.size() > 1 && HOUSE_NUMBER_SUFFIX.matcher(first).find()) {
            return places.get(1);
        }
        return first;
    }

    private static boolean isQualifier(String segment) {
        return QUALIFIER_PREFIX.matcher(segment).find() || QUALIFIER_SUFFIX.matcher(segment).find();
    }

    private static String stripQualifier(String segment) {
        String stripped = QUALIFIER_PREFIX.matcher(segment).replaceFirst("");
        return QUALIFIER_SUFFIX.matcher(stripped).replaceFirst("").trim();
    }
}
