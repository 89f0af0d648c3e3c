package com.nevis.pdfscan.scanner;

import com.nevis.pdfscan.model.FindingType;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record RegexPatternMatcher(FindingType type, Pattern pattern) implements PatternMatcher {

    public static final double EXACT_MATCH_CONFIDENCE = 1.0;

    public RegexPatternMatcher {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(pattern, "pattern");
    }

    public static RegexPatternMatcher of(FindingType type, String regex) {
        return new RegexPatternMatcher(type, Pattern.compile(regex));
    }

    @Override
    public double confidence() {
        return EXACT_MATCH_CONFIDENCE;
    }

    @Override
    public int countMatches(String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
