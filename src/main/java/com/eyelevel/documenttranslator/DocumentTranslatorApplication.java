package com.eyelevel.documenttranslator;

import com.eyelevel.documenttranslator.config.DocumentTranslationConfig;
import com.eyelevel.documenttranslator.config.PipelineProperties;
import com.eyelevel.documenttranslator.config.TranslationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Document Translator Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.processing", "app.pipeline" and
 *     "app.translation" property trees to their configuration classes.</li>
 *     <li>{@link EnableScheduling}: Activates the stalled-job sweep.</li>
 *     <li>{@link EnableJpaRepositories}: Configures the base package for scanning Spring Data JPA repositories.</li>
 *     <li>{@link EnableRetry}: Enables Spring Retry support used by the translation providers.</li>
 * </ul>
 * The stage workers start with the context, see {@link com.eyelevel.documenttranslator.worker.StageWorkerPool}.
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.documenttranslator.repository")
@EnableConfigurationProperties(value = {DocumentTranslationConfig.class, PipelineProperties.class,
        TranslationProperties.class})
@EnableRetry
public class DocumentTranslatorApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("🚀 Starting DocumentTranslatorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DocumentTranslatorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "DocumentTranslator"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("  - Queues:     {}", env.getProperty("app.pipeline.queue-backend", "sqs"));
        log.info("------------------------------------------------------------------");
    }
}
