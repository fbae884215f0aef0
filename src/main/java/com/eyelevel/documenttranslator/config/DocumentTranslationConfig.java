package com.eyelevel.documenttranslator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Set;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object: upload limits, accepted file types and local storage locations.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class DocumentTranslationConfig {

    private long maxFileSize = 100L * 1024 * 1024;
    private Set<String> supportedExtensions = Set.of("pdf", "txt", "doc", "docx");
    private Storage storage = new Storage();
    private Estimation estimation = new Estimation();

    @Data
    public static class Storage {
        private String uploadDir = "data/uploads";
        private String artifactDir = "data/artifacts";
        private String outputDir = "data/outputs";
    }

    @Data
    public static class Estimation {
        /**
         * Upper bound for the size-based page estimate of Word documents.
         */
        private int maxWordPages = 500;
        private int wordKilobytesPerPage = 3;
    }
}
