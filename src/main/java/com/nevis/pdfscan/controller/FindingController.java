package com.nevis.pdfscan.controller;

import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;
import com.nevis.pdfscan.model.PageRequest;
import com.nevis.pdfscan.service.DocumentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequiredArgsConstructor
public class FindingController {

    private final DocumentService documentService;

    @GetMapping("/findings")
    public ResponseEntity<PageResponse<Finding>> listFindings(
        @RequestParam(name = "finding_type", required = false) Optional<String> findingType,
        @RequestParam(defaultValue = "100") int limit,
        @RequestParam(defaultValue = "0") int offset) {

        var page = documentService.listFindings(
            findingType.map(FindingType::fromTag),
            PageRequest.of(limit, offset)
        );
        return ResponseEntity.ok(PageResponse.from(page));
    }
}
