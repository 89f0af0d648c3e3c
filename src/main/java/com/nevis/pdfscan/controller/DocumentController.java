package com.nevis.pdfscan.controller;

import com.nevis.pdfscan.exception.ValidationException;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.PageRequest;
import com.nevis.pdfscan.model.ProcessingResult;
import com.nevis.pdfscan.processing.DocumentProcessor;
import com.nevis.pdfscan.service.DocumentService;
import com.nevis.pdfscan.validation.UploadValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentProcessor documentProcessor;
    private final DocumentService documentService;
    private final UploadValidator uploadValidator;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProcessingResult> upload(@RequestParam("file") MultipartFile file) {
        uploadValidator.validate(file.getOriginalFilename(), file.getContentType(), file.getSize());

        ProcessingResult result = documentProcessor.processUpload(
            readContent(file),
            file.getOriginalFilename(),
            file.getSize()
        );

        return ResponseEntity.ok(result);
    }

    @GetMapping("/documents")
    public ResponseEntity<PageResponse<Document>> listDocuments(
        @RequestParam(defaultValue = "100") int limit,
        @RequestParam(defaultValue = "0") int offset) {

        return ResponseEntity.ok(PageResponse.from(documentService.listDocuments(PageRequest.of(limit, offset))));
    }

    @GetMapping("/documents/{id}")
    public ResponseEntity<Document> getDocument(@PathVariable UUID id) {
        return ResponseEntity.ok(documentService.getDocument(id));
    }

    @GetMapping("/documents/{id}/findings")
    public ResponseEntity<List<Finding>> getFindings(@PathVariable UUID id) {
        return ResponseEntity.ok(documentService.getFindingsForDocument(id));
    }

    private static byte[] readContent(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new ValidationException(ValidationException.FILE_READ_ERROR, "Failed to read file: " + e.getMessage());
        }
    }
}
