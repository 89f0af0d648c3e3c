package com.nevis.pdfscan.extraction;

import com.nevis.pdfscan.exception.DocumentUnreadableException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDFBox-backed extractor. Opening the document is all-or-nothing; a single page whose
 * text cannot be stripped comes back as an empty page instead.
 */
@Slf4j
@Component
public class PdfBoxTextExtractor implements TextExtractor {

    static final String PASSWORD_PROTECTED = "PDF is password-protected and cannot be scanned";

    @Override
    public List<String> extractPages(byte[] content) {
        if (content == null || content.length == 0) {
            throw new DocumentUnreadableException("Document is empty");
        }

        try (PDDocument document = Loader.loadPDF(content)) {
            if (document.isEncrypted()) {
                throw new DocumentUnreadableException(PASSWORD_PROTECTED);
            }
            return extractEachPage(document);
        } catch (InvalidPasswordException e) {
            throw new DocumentUnreadableException(PASSWORD_PROTECTED, e);
        } catch (IOException e) {
            throw new DocumentUnreadableException("Invalid or corrupt PDF file: " + e.getMessage(), e);
        }
    }

    private List<String> extractEachPage(PDDocument document) throws IOException {
        int pageCount = document.getNumberOfPages();
        List<String> pages = new ArrayList<>(pageCount);
        PDFTextStripper stripper = new PDFTextStripper();

        for (int page = 1; page <= pageCount; page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            try {
                pages.add(stripper.getText(document));
            } catch (IOException e) {
                log.warn("Could not extract text from page {}: {}", page, e.getMessage());
                pages.add("");
            }
        }
        return pages;
    }
}
