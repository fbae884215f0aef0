package com.eyelevel.documenttranslator.controller;

import com.eyelevel.documenttranslator.dto.common.ApiResponse;
import com.eyelevel.documenttranslator.dto.job.JobStatusResponse;
import com.eyelevel.documenttranslator.dto.queue.QueueStatusResponse;
import com.eyelevel.documenttranslator.dto.submission.SubmissionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

@Tag(name = "Document Translation", description = "Endpoints for submitting documents for translation and tracking the resulting jobs.")
public interface TranslationJobApi {

    @Operation(summary = "Submit Document",
            description = "Uploads a PDF, TXT, DOC or DOCX file and creates an asynchronous translation job. The job moves through extraction, chunking, translation and reconstruction.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Document accepted and queued for translation.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "displayMessage": "Document accepted for translation.",
                                        "response": {
                                            "jobId": "3f0c8a52-2f0e-4b36-9a43-6c1d3b1f2e77",
                                            "status": "PENDING",
                                            "totalPages": 12,
                                            "estimatedTime": "3 minutes"
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Empty file, unsupported type, or invalid language or tier.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "413", description = "Payload Too Large - The file exceeds the maximum size.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<SubmissionResponse>> submitDocument(
            @Parameter(description = "The document to translate.", required = true)
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Source language code or name. Defaults to auto-detection.", example = "en")
            @RequestParam(value = "sourceLang", required = false) String sourceLang,
            @Parameter(description = "Target language code or name.", example = "vi")
            @RequestParam(value = "targetLang", required = false) String targetLang,
            @Parameter(description = "Translation tier: basic, standard or premium.", example = "standard")
            @RequestParam(value = "tier", required = false) String tier);

    @Operation(summary = "Get Job Status",
            description = "Returns the current status, progress and page counters of a translation job.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> getJobStatus(
            @Parameter(description = "The job id returned at submission.", required = true)
            @PathVariable String jobId);

    @Operation(summary = "Cancel Job",
            description = "Cancels an in-flight job. The job is marked FAILED with reason 'Cancelled by user'; the worker holding it drops its result.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job cancelled.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The job is already completed or failed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> cancelJob(
            @Parameter(description = "The job to cancel.", required = true)
            @PathVariable String jobId);

    @Operation(summary = "Get Queue Status",
            description = "Returns the number of pending entries in each stage queue and the most recent active jobs. SQS counts are approximate.")
    ResponseEntity<ApiResponse<QueueStatusResponse>> getQueueStatus();

    @Operation(summary = "Download Translation",
            description = "Returns the translated document as plain text. Only available once the job is COMPLETED.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Translated text.",
                    content = @Content(mediaType = "text/plain")),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The job has not completed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<String> downloadTranslation(
            @Parameter(description = "The completed job.", required = true)
            @PathVariable String jobId);

    @Operation(summary = "[ADMIN] Delete Job",
            description = "**DANGER:** Permanently deletes a job record together with its upload, artifacts and output. Running jobs are failed first.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job deleted.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Void>> deleteJob(
            @Parameter(description = "The job to delete.", required = true)
            @PathVariable String jobId);
}
