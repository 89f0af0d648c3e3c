package com.nevis.pdfscan.scanner;

import com.nevis.pdfscan.model.FindingCandidate;
import com.nevis.pdfscan.model.FindingType;

import java.util.List;
import java.util.Set;

public interface DocumentScanner {

    /**
     * Scans already-extracted page texts. {@code pages.get(0)} is page 1.
     * A page that cannot be matched contributes nothing; it never aborts the scan.
     */
    List<FindingCandidate> scan(List<String> pages);

    Set<FindingType> supportedTypes();
}
