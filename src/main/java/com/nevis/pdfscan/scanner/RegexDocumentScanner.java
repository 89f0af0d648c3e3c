package com.nevis.pdfscan.scanner;

import com.nevis.pdfscan.model.FindingCandidate;
import com.nevis.pdfscan.model.FindingType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Slf4j
@RequiredArgsConstructor
public class RegexDocumentScanner implements DocumentScanner {

    private final PatternRegistry registry;

    @Override
    public List<FindingCandidate> scan(List<String> pages) {
        List<FindingCandidate> candidates = new ArrayList<>();

        for (int i = 0; i < pages.size(); i++) {
            int pageNumber = i + 1;
            String text = pages.get(i);

            if (text == null || text.isBlank()) {
                continue;
            }

            try {
                candidates.addAll(scanPage(text, pageNumber));
            } catch (RuntimeException e) {
                log.warn("Skipping page {}: matching failed ({})", pageNumber, e.getMessage());
            }
        }

        log.debug("Scanned {} pages, {} candidates", pages.size(), candidates.size());
        return candidates;
    }

    // all-or-nothing per page: a failing matcher drops the page's earlier matches too
    private List<FindingCandidate> scanPage(String text, int pageNumber) {
        String location = "page " + pageNumber;
        List<FindingCandidate> pageCandidates = new ArrayList<>();

        for (PatternMatcher matcher : registry.matchers()) {
            int matches = matcher.countMatches(text);
            for (int n = 0; n < matches; n++) {
                pageCandidates.add(new FindingCandidate(matcher.type(), location, matcher.confidence()));
            }
        }
        return pageCandidates;
    }

    @Override
    public Set<FindingType> supportedTypes() {
        return registry.types();
    }
}
