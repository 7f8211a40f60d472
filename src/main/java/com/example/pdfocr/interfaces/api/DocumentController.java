package com.example.pdfocr.interfaces.api;

import com.example.pdfocr.application.service.DocumentProcessor;
import com.example.pdfocr.application.service.DocumentUploadService;
import com.example.pdfocr.domain.model.ProcessedDocument;
import com.example.pdfocr.domain.model.ProcessingResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interfaces-layer controller for uploading PDFs, processing stored ones, and reading extraction outputs.
 */
@Controller
public class DocumentController {

    private final DocumentUploadService uploadService;
    private final DocumentProcessor processor;

    /**
     * Creates the controller with the required application services.
     *
     * @param uploadService service storing and processing uploads
     * @param processor     service processing stored documents and reading outputs
     */
    public DocumentController(DocumentUploadService uploadService, DocumentProcessor processor) {
        this.uploadService = uploadService;
        this.processor = processor;
    }

    /**
     * Stores the uploaded PDF in the input folder and extracts its text.
     *
     * @param file uploaded PDF
     * @return processing result; failures are reported with a non-2xx status
     */
    @PostMapping(value = "/api/documents", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<ProcessingResult> upload(@RequestParam("file") MultipartFile file) {
        return toResponse(uploadService.uploadAndProcess(file));
    }

    /**
     * Extracts the text of a PDF already stored in the bucket.
     *
     * @param key object key of the PDF
     * @return processing result; failures are reported with a non-2xx status
     */
    @PostMapping(value = "/api/documents/process", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<ProcessingResult> process(@RequestParam("key") String key) {
        return toResponse(processor.process(key));
    }

    @GetMapping(value = "/api/documents", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public List<ProcessedDocument> listProcessed() {
        return processor.listProcessed();
    }

    /**
     * Streams the stored text of a processed document.
     *
     * @param name document name from the listing
     * @return extracted text
     */
    @GetMapping(value = "/api/documents/{name}/text", produces = MediaType.TEXT_PLAIN_VALUE)
    @ResponseBody
    public ResponseEntity<String> text(@PathVariable("name") String name) {
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(processor.readText(name));
    }

    /**
     * Same as {@link #text(String)} for names that keep sub-folders, e.g. {@code reports/q3}.
     *
     * @param name document name from the listing
     * @return extracted text
     */
    @GetMapping(value = "/api/documents/text", produces = MediaType.TEXT_PLAIN_VALUE)
    @ResponseBody
    public ResponseEntity<String> textByName(@RequestParam("name") String name) {
        return text(name);
    }

    private ResponseEntity<ProcessingResult> toResponse(ProcessingResult result) {
        HttpStatus status = switch (result.status()) {
            case COMPLETED -> HttpStatus.OK;
            case FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
        return ResponseEntity.status(status).body(result);
    }
}
