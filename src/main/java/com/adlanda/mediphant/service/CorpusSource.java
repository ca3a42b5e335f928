package com.adlanda.mediphant.service;

import com.adlanda.mediphant.config.FaqProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads the raw corpus document from the configured resource location.
 */
@Component
public class CorpusSource {

    private final ResourceLoader resourceLoader;
    private final String location;

    public CorpusSource(ResourceLoader resourceLoader, FaqProperties properties) {
        this.resourceLoader = resourceLoader;
        this.location = properties.getCorpus().getLocation();
    }

    public Document read() {
        Resource resource = resourceLoader.getResource(location);
        String sourceRef = resource.getFilename() != null ? resource.getFilename() : location;
        try (InputStream in = resource.getInputStream()) {
            return new Document(sourceRef, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read corpus from " + location, e);
        }
    }

    /**
     * @param sourceRef File name of the corpus
     * @param content   Full document text
     */
    public record Document(String sourceRef, String content) {}
}
