package com.nevis.pdfscan.scanner;

import com.nevis.pdfscan.model.FindingType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered list of matchers applied to every page. Matchers run in registration order,
 * which is also the order of the findings they produce on a page.
 */
public final class PatternRegistry {

    static final String SSN_REGEX = "\\b\\d{3}-\\d{2}-\\d{4}\\b";
    static final String EMAIL_REGEX = "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b";

    private final List<PatternMatcher> matchers = new ArrayList<>();

    public static PatternRegistry defaults() {
        return new PatternRegistry()
            .register(RegexPatternMatcher.of(FindingType.SSN, SSN_REGEX))
            .register(RegexPatternMatcher.of(FindingType.EMAIL, EMAIL_REGEX));
    }

    public PatternRegistry register(PatternMatcher matcher) {
        matchers.add(matcher);
        return this;
    }

    public List<PatternMatcher> matchers() {
        return Collections.unmodifiableList(matchers);
    }

    public Set<FindingType> types() {
        Set<FindingType> types = EnumSet.noneOf(FindingType.class);
        matchers.forEach(m -> types.add(m.type()));
        return Collections.unmodifiableSet(types);
    }
}
