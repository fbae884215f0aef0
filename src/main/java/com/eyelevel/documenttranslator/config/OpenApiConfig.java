package com.eyelevel.documenttranslator.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Document Translator API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                This API translates whole documents asynchronously.
                                A submitted PDF, Word or plain-text file becomes a job that moves through
                                extraction, chunking, translation and reconstruction, each stage served
                                by its own queue and worker pool.
                                
                                Key features include:
                                * **Tiered Translation:** basic, standard (with retries) and premium (LLM-backed with fallback).
                                * **Progress Tracking:** Every job reports its status, progress and processed pages.
                                * **Cancellation:** In-flight jobs can be cancelled at any stage.
                                
                                **Note:** Administrative endpoints, such as deleting jobs, are marked and should be used with caution.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
