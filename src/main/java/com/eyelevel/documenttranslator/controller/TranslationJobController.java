package com.eyelevel.documenttranslator.controller;

import com.eyelevel.documenttranslator.dto.common.ApiResponse;
import com.eyelevel.documenttranslator.dto.job.JobStatusResponse;
import com.eyelevel.documenttranslator.dto.queue.QueueStatusResponse;
import com.eyelevel.documenttranslator.dto.submission.SubmissionResponse;
import com.eyelevel.documenttranslator.service.job.JobAdministrationService;
import com.eyelevel.documenttranslator.service.job.JobQueueManager;
import com.eyelevel.documenttranslator.service.job.TranslationJobViewService;
import com.eyelevel.documenttranslator.service.submission.DocumentSubmissionService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;

/**
 * REST controller for the translation job lifecycle: submission, status, cancellation, queue
 * monitoring, download and administrative deletion.
 * All JSON responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/translations")
@RequiredArgsConstructor
@Validated
public class TranslationJobController implements TranslationJobApi {

    private final DocumentSubmissionService documentSubmissionService;
    private final TranslationJobViewService translationJobViewService;
    private final JobQueueManager jobQueueManager;
    private final JobAdministrationService jobAdministrationService;

    @Override
    @PostMapping(value = "/v1/jobs", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<SubmissionResponse>> submitDocument(
            @RequestParam("file") final MultipartFile file,
            @RequestParam(value = "sourceLang", required = false) final String sourceLang,
            @RequestParam(value = "targetLang", required = false) final String targetLang,
            @RequestParam(value = "tier", required = false) final String tier) {

        log.info("Received translation request for file: {}, sourceLang: {}, targetLang: {}, tier: {}",
                file.getOriginalFilename(), sourceLang, targetLang, tier);

        SubmissionResponse responseData = documentSubmissionService.submit(file, sourceLang, targetLang, tier);

        ApiResponse<SubmissionResponse> response = ApiResponse.<SubmissionResponse>builder()
                .response(responseData)
                .displayMessage("Document accepted for translation.")
                .showMessage(true)
                .statusCode(HttpStatus.ACCEPTED.value())
                .build();

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @Override
    @GetMapping("/v1/jobs/{jobId}")
    public ResponseEntity<ApiResponse<JobStatusResponse>> getJobStatus(
            @PathVariable @NotBlank(message = "The 'jobId' cannot be empty.") final String jobId) {

        log.debug("Fetching status for job ID: {}", jobId);
        JobStatusResponse responseData = translationJobViewService.getStatus(jobId);

        ApiResponse<JobStatusResponse> response = ApiResponse.<JobStatusResponse>builder()
                .response(responseData)
                .displayMessage("Job status retrieved successfully.")
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @PostMapping("/v1/jobs/{jobId}/cancel")
    public ResponseEntity<ApiResponse<JobStatusResponse>> cancelJob(
            @PathVariable @NotBlank(message = "The 'jobId' cannot be empty.") final String jobId) {

        log.info("Received request to cancel job ID: {}", jobId);
        JobStatusResponse responseData = JobStatusResponse.from(jobQueueManager.cancelJob(jobId));

        ApiResponse<JobStatusResponse> response = ApiResponse.<JobStatusResponse>builder()
                .response(responseData)
                .displayMessage("Job cancelled successfully.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/v1/queues/status")
    public ResponseEntity<ApiResponse<QueueStatusResponse>> getQueueStatus() {
        QueueStatusResponse responseData = translationJobViewService.getQueueStatus();

        ApiResponse<QueueStatusResponse> response = ApiResponse.<QueueStatusResponse>builder()
                .response(responseData)
                .displayMessage("Queue status retrieved successfully.")
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/v1/jobs/{jobId}/download")
    public ResponseEntity<String> downloadTranslation(
            @PathVariable @NotBlank(message = "The 'jobId' cannot be empty.") final String jobId) {

        log.info("Received download request for job ID: {}", jobId);
        String content = translationJobViewService.getTranslatedText(jobId);

        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + jobId + "_translated.txt\"")
                .body(content);
    }

    // --- ADMIN ENDPOINTS ---

    @Override
    @DeleteMapping("/v1/admin/jobs/{jobId}")
    public ResponseEntity<ApiResponse<Void>> deleteJob(
            @PathVariable @NotBlank(message = "The 'jobId' cannot be empty.") final String jobId) {

        log.warn("ADMIN ACTION: Received request to delete job ID: {}", jobId);
        jobAdministrationService.deleteJob(jobId);

        ApiResponse<Void> response = ApiResponse.<Void>builder()
                .displayMessage("Job " + jobId + " deleted.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }
}
