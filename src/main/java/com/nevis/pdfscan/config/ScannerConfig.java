package com.nevis.pdfscan.config;

import com.nevis.pdfscan.scanner.DocumentScanner;
import com.nevis.pdfscan.scanner.PatternRegistry;
import com.nevis.pdfscan.scanner.RegexDocumentScanner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ScannerConfig {

    @Bean
    public PatternRegistry patternRegistry() {
        return PatternRegistry.defaults();
    }

    @Bean
    public DocumentScanner documentScanner(PatternRegistry patternRegistry) {
        return new RegexDocumentScanner(patternRegistry);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
