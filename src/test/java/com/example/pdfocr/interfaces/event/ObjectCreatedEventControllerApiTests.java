package com.example.pdfocr.interfaces.event;

import com.example.pdfocr.application.service.DocumentEventHandler;
import com.example.pdfocr.domain.model.DocumentNotification;
import com.example.pdfocr.domain.model.ProcessingResult;
import com.example.pdfocr.domain.model.ProcessingStatus;
import com.example.pdfocr.domain.model.ProcessingSummary;
import com.example.pdfocr.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests for the notification endpoint.
 */
@WebMvcTest(controllers = ObjectCreatedEventController.class)
@Import(GlobalExceptionHandler.class)
class ObjectCreatedEventControllerApiTests {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DocumentEventHandler eventHandler;

    /**
     * Verifies that records are handed over in order and the summary is returned.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    @SuppressWarnings("unchecked")
    void handsRecordsToHandlerAndReturnsSummary() throws Exception {
        ProcessingSummary summary = ProcessingSummary.of(List.of(
                ProcessingResult.failed(ProcessingStatus.FAILED, "input/a.pdf", null, "boom", 3, NOW)
        ), 1, 25, NOW);
        BDDMockito.given(eventHandler.handle(anyList())).willReturn(summary);

        mockMvc.perform(post("/api/events/object-created")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"records": [
                                  {"bucket": "pdf-ocr-documents", "key": "input/a.pdf"},
                                  {"bucket": "pdf-ocr-documents", "key": "input/readme.txt"}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalProcessed").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.skipped").value(1))
                .andExpect(jsonPath("$.message").value("Processed 1 document(s): 0 successful, 1 failed"))
                .andExpect(jsonPath("$.results[0].errorMessage").value("boom"));

        ArgumentCaptor<List<DocumentNotification>> notifications = ArgumentCaptor.forClass(List.class);
        verify(eventHandler).handle(notifications.capture());
        assertThat(notifications.getValue()).containsExactly(
                new DocumentNotification("pdf-ocr-documents", "input/a.pdf"),
                new DocumentNotification("pdf-ocr-documents", "input/readme.txt"));
    }

    /**
     * Verifies that a body without records is rejected with HTTP 400.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void missingRecordsMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/events/object-created")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
        verifyNoInteractions(eventHandler);
    }

    /**
     * Verifies that a null record is handed over as an empty notification and the batch still succeeds.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    @SuppressWarnings("unchecked")
    void nullRecordDoesNotAbortBatch() throws Exception {
        BDDMockito.given(eventHandler.handle(anyList()))
                .willReturn(ProcessingSummary.of(List.of(), 1, 5, NOW));

        mockMvc.perform(post("/api/events/object-created")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\":[null,{\"bucket\":\"test-bucket\",\"key\":\"input/a.pdf\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skipped").value(1));

        ArgumentCaptor<List<DocumentNotification>> notifications = ArgumentCaptor.forClass(List.class);
        verify(eventHandler).handle(notifications.capture());
        assertThat(notifications.getValue()).containsExactly(
                new DocumentNotification(null, null),
                new DocumentNotification("test-bucket", "input/a.pdf"));
    }

    @Test
    void malformedBodyMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/events/object-created")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }
}
