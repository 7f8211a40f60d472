package com.example.pdfocr.application.service;

import com.example.pdfocr.infrastructure.config.PipelineProperties;
import org.springframework.stereotype.Component;

/**
 * Derives output keys from input keys: the input folder is swapped for the output folder and the
 * extension for the output extension. Sub-folders below the input folder are kept.
 */
@Component
public class DocumentKeys {

    public static final String TEXT_EXTENSION = ".txt";
    public static final String METADATA_EXTENSION = ".json";
    public static final String ERROR_SUFFIX = "_error";

    private final String inputPrefix;
    private final String textPrefix;
    private final String metadataPrefix;
    private final String errorPrefix;

    public DocumentKeys(PipelineProperties properties) {
        PipelineProperties.Storage storage = properties.storage();
        this.inputPrefix = folder(storage.inputPrefix());
        this.textPrefix = folder(storage.textPrefix());
        this.metadataPrefix = folder(storage.metadataPrefix());
        this.errorPrefix = folder(storage.errorPrefix());
    }

    public String inputPrefix() {
        return inputPrefix;
    }

    public String metadataPrefix() {
        return metadataPrefix;
    }

    /**
     * @param fileName plain file name of an upload
     * @return key of the upload inside the input folder
     */
    public String inputKeyFor(String fileName) {
        return inputPrefix + fileName;
    }

    public String textKeyFor(String inputKey) {
        return textPrefix + nameOf(inputKey) + TEXT_EXTENSION;
    }

    public String metadataKeyFor(String inputKey) {
        return metadataPrefix + nameOf(inputKey) + METADATA_EXTENSION;
    }

    public String errorKeyFor(String inputKey) {
        return errorPrefix + nameOf(inputKey) + ERROR_SUFFIX + METADATA_EXTENSION;
    }

    /**
     * Document name shared by all outputs: the key relative to the input folder, without extension.
     *
     * @param inputKey key of the input document
     * @return e.g. {@code reports/q3} for {@code input/reports/q3.pdf}
     */
    public String nameOf(String inputKey) {
        String relative = inputKey.startsWith(inputPrefix) ? inputKey.substring(inputPrefix.length()) : inputKey;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        int slash = relative.lastIndexOf('/');
        int dot = relative.lastIndexOf('.');
        return dot > slash + 1 ? relative.substring(0, dot) : relative;
    }

    /**
     * Reverse of {@link #metadataKeyFor(String)}.
     *
     * @param metadataKey key below the metadata folder
     * @return document name, or {@code null} when the key is not a metadata document
     */
    public String nameOfMetadataKey(String metadataKey) {
        if (!metadataKey.startsWith(metadataPrefix) || !metadataKey.endsWith(METADATA_EXTENSION)) {
            return null;
        }
        String name = metadataKey.substring(metadataPrefix.length(), metadataKey.length() - METADATA_EXTENSION.length());
        return name.isEmpty() ? null : name;
    }

    public String textKeyForName(String name) {
        return textPrefix + name + TEXT_EXTENSION;
    }

    private static String folder(String prefix) {
        return prefix.endsWith("/") ? prefix : prefix + "/";
    }
}
