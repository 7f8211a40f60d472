package com.example.pdfocr.interfaces.event;

import com.example.pdfocr.application.exception.UseCaseValidationException;
import com.example.pdfocr.application.service.DocumentEventHandler;
import com.example.pdfocr.domain.model.DocumentNotification;
import com.example.pdfocr.domain.model.ProcessingSummary;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Receives batches of "object created" notifications and answers with the aggregate processing summary.
 */
@RestController
public class ObjectCreatedEventController {

    private final DocumentEventHandler eventHandler;

    public ObjectCreatedEventController(DocumentEventHandler eventHandler) {
        this.eventHandler = eventHandler;
    }

    @PostMapping(value = "/api/events/object-created",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ProcessingSummary objectCreated(@RequestBody ObjectCreatedEventRequest request) {
        if (request == null || request.records() == null) {
            throw new UseCaseValidationException("Invalid event structure - no records found");
        }
        List<DocumentNotification> notifications = request.records().stream()
                .map(entry -> entry != null
                        ? new DocumentNotification(entry.bucket(), entry.key())
                        : new DocumentNotification(null, null))
                .toList();
        return eventHandler.handle(notifications);
    }
}
