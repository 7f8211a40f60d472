package com.example.pdfocr.application.service;

import com.example.pdfocr.application.exception.ExtractionQualityException;
import com.example.pdfocr.application.exception.ExtractionTimeoutException;
import com.example.pdfocr.domain.exception.DocumentNotFoundException;
import com.example.pdfocr.domain.exception.DocumentValidationException;
import com.example.pdfocr.domain.exception.UnsupportedPdfFormatException;
import com.example.pdfocr.domain.model.ExtractionMethod;
import com.example.pdfocr.domain.model.ExtractionResult;
import com.example.pdfocr.domain.model.OcrBlock;
import com.example.pdfocr.domain.model.OcrBlockType;
import com.example.pdfocr.domain.model.OcrDocument;
import com.example.pdfocr.domain.model.OcrJobPage;
import com.example.pdfocr.domain.model.OcrJobStatus;
import com.example.pdfocr.domain.model.StoredObject;
import com.example.pdfocr.domain.port.ObjectStoreGateway;
import com.example.pdfocr.domain.port.OcrGateway;
import com.example.pdfocr.infrastructure.config.PipelineProperties;
import com.example.pdfocr.infrastructure.config.PipelinePropertiesFixtures;
import com.example.pdfocr.infrastructure.exception.OcrJobFailedException;
import com.example.pdfocr.infrastructure.pdf.PdfBoxDocumentInspector;
import com.example.pdfocr.infrastructure.pdf.SamplePdfs;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for strategy selection, job polling and result aggregation.
 */
class ExtractionOrchestratorTest {

    private static final long MB = 1024L * 1024L;
    private static final String BUCKET = PipelinePropertiesFixtures.BUCKET;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    private final ObjectStoreGateway objectStore = Mockito.mock(ObjectStoreGateway.class);
    private final OcrGateway ocrGateway = Mockito.mock(OcrGateway.class);

    @Test
    void selectsStrategyBySize() {
        ExtractionOrchestrator orchestrator = orchestrator(PipelinePropertiesFixtures.extraction());

        assertThat(orchestrator.selectMethod(5 * MB - 1)).isEqualTo(ExtractionMethod.SYNC);
        assertThat(orchestrator.selectMethod(5 * MB)).isEqualTo(ExtractionMethod.ASYNC);
        assertThat(orchestrator.selectMethod(50 * MB)).isEqualTo(ExtractionMethod.ASYNC);
    }

    /**
     * Small documents are sent by value and their lines come back in reading order.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void smallDocumentUsesSynchronousDetection() throws Exception {
        byte[] pdf = SamplePdfs.create("Invoice", "Invoice 2024");
        stored("input/invoice.pdf", pdf.length);
        BDDMockito.given(objectStore.download("input/invoice.pdf")).willReturn(pdf);
        BDDMockito.given(ocrGateway.detectText(pdf)).willReturn(new OcrDocument(List.of(
                new OcrBlock(OcrBlockType.PAGE, null, null, 1, 0f, 0f),
                new OcrBlock(OcrBlockType.LINE, "Total: 42 EUR", 97f, 1, 0.50f, 0.10f),
                new OcrBlock(OcrBlockType.LINE, "Invoice 2024", 99f, 1, 0.10f, 0.40f),
                new OcrBlock(OcrBlockType.LINE, "ACME Corp", 98f, 1, 0.10f, 0.05f),
                new OcrBlock(OcrBlockType.WORD, "Invoice", 99f, 1, 0.10f, 0.40f)
        ), 1));

        ExtractionResult result = orchestrator(PipelinePropertiesFixtures.extraction()).extract("input/invoice.pdf");

        assertThat(result.method()).isEqualTo(ExtractionMethod.SYNC);
        assertThat(result.text()).isEqualTo("ACME Corp\nInvoice 2024\nTotal: 42 EUR");
        assertThat(result.pageCount()).isEqualTo(1);
        assertThat(result.confidenceStats().totalBlocks()).isEqualTo(4);
        assertThat(result.highQuality()).isTrue();
        assertThat(result.documentInfo()).isNotNull();
        assertThat(result.documentInfo().title()).isEqualTo("Invoice");
        assertThat(result.timestamp()).isEqualTo(CLOCK.instant());
        verify(ocrGateway, never()).startTextDetection(anyString(), anyString());
    }

    @Test
    void synchronousPathRejectsContentWithoutPdfSignature() {
        byte[] content = "plain text pretending".getBytes(StandardCharsets.UTF_8);
        stored("input/fake.pdf", content.length);
        BDDMockito.given(objectStore.download("input/fake.pdf")).willReturn(content);

        assertThatThrownBy(() -> orchestrator(PipelinePropertiesFixtures.extraction()).extract("input/fake.pdf"))
                .isInstanceOf(UnsupportedPdfFormatException.class);
        verifyNoInteractions(ocrGateway);
    }

    /**
     * Large documents are submitted by reference, polled until done and read across every result page.
     */
    @Test
    void largeDocumentUsesAsynchronousJobAndReadsAllPages() {
        stored("input/big.pdf", 6 * MB);
        BDDMockito.given(objectStore.bucket()).willReturn(BUCKET);
        BDDMockito.given(ocrGateway.startTextDetection(BUCKET, "input/big.pdf")).willReturn("job-1");
        BDDMockito.given(ocrGateway.getTextDetection("job-1", null)).willReturn(
                new OcrJobPage(OcrJobStatus.IN_PROGRESS, null, List.of(), null, null),
                new OcrJobPage(OcrJobStatus.SUCCEEDED, null, List.of(
                        new OcrBlock(OcrBlockType.LINE, "Second page", 95f, 2, 0.1f, 0.1f)
                ), 2, "token-2"));
        BDDMockito.given(ocrGateway.getTextDetection("job-1", "token-2")).willReturn(
                new OcrJobPage(OcrJobStatus.SUCCEEDED, null, List.of(
                        new OcrBlock(OcrBlockType.LINE, "First page", 96f, 1, 0.1f, 0.1f)
                ), 2, null));

        ExtractionResult result = orchestrator(PipelinePropertiesFixtures.extraction()).extract("input/big.pdf");

        assertThat(result.method()).isEqualTo(ExtractionMethod.ASYNC);
        assertThat(result.text()).isEqualTo("First page\nSecond page");
        assertThat(result.pageCount()).isEqualTo(2);
        assertThat(result.documentInfo()).isNull();
        assertThat(result.warnings()).anyMatch(warning -> warning.contains("asynchronous"));
        verify(ocrGateway, times(2)).getTextDetection("job-1", null);
        verify(ocrGateway).getTextDetection("job-1", "token-2");
        verify(objectStore, never()).download(anyString());
    }

    @Test
    void asynchronousJobTimesOutWhenWaitBudgetIsSpent() {
        stored("input/slow.pdf", 6 * MB);
        BDDMockito.given(objectStore.bucket()).willReturn(BUCKET);
        BDDMockito.given(ocrGateway.startTextDetection(BUCKET, "input/slow.pdf")).willReturn("job-slow");
        BDDMockito.given(ocrGateway.getTextDetection("job-slow", null))
                .willReturn(new OcrJobPage(OcrJobStatus.IN_PROGRESS, null, List.of(), null, null));

        ExtractionOrchestrator orchestrator = orchestrator(PipelinePropertiesFixtures.extraction(Duration.ZERO, false));

        assertThatThrownBy(() -> orchestrator.extract("input/slow.pdf"))
                .isInstanceOfSatisfying(ExtractionTimeoutException.class,
                        ex -> assertThat(ex.getJobId()).isEqualTo("job-slow"));
    }

    @Test
    void failedJobRaisesOcrJobFailedException() {
        stored("input/broken.pdf", 6 * MB);
        BDDMockito.given(objectStore.bucket()).willReturn(BUCKET);
        BDDMockito.given(ocrGateway.startTextDetection(BUCKET, "input/broken.pdf")).willReturn("job-2");
        BDDMockito.given(ocrGateway.getTextDetection("job-2", null))
                .willReturn(new OcrJobPage(OcrJobStatus.FAILED, "Internal error", List.of(), null, null));

        assertThatThrownBy(() -> orchestrator(PipelinePropertiesFixtures.extraction()).extract("input/broken.pdf"))
                .isInstanceOf(OcrJobFailedException.class)
                .hasMessageContaining("Internal error");
    }

    @Test
    void partialSuccessKeepsResultsAndAddsWarning() {
        stored("input/partial.pdf", 6 * MB);
        BDDMockito.given(objectStore.bucket()).willReturn(BUCKET);
        BDDMockito.given(ocrGateway.startTextDetection(BUCKET, "input/partial.pdf")).willReturn("job-3");
        BDDMockito.given(ocrGateway.getTextDetection("job-3", null)).willReturn(new OcrJobPage(
                OcrJobStatus.PARTIAL_SUCCESS, "Page 3 unreadable", List.of(
                        new OcrBlock(OcrBlockType.LINE, "a", 90f, 1, 0f, 0f),
                        new OcrBlock(OcrBlockType.LINE, "b", 90f, 2, 0f, 0f),
                        new OcrBlock(OcrBlockType.LINE, "c", 90f, 4, 0f, 0f)
                ), null, null));

        ExtractionResult result = orchestrator(PipelinePropertiesFixtures.extraction()).extract("input/partial.pdf");

        assertThat(result.warnings()).anyMatch(warning -> warning.contains("Page 3 unreadable"));
        // no reported page count: distinct block pages are counted
        assertThat(result.pageCount()).isEqualTo(3);
    }

    @Test
    void missingDocumentFailsValidationWithoutCallingOcr() {
        BDDMockito.given(objectStore.describe("input/missing.pdf")).willReturn(Optional.empty());

        assertThatThrownBy(() -> orchestrator(PipelinePropertiesFixtures.extraction()).extract("input/missing.pdf"))
                .isInstanceOf(DocumentNotFoundException.class);
        verifyNoInteractions(ocrGateway);
    }

    @Test
    void unsupportedExtensionFailsValidation() {
        assertThatThrownBy(() -> orchestrator(PipelinePropertiesFixtures.extraction()).extract("input/notes.docx", 100))
                .isInstanceOf(UnsupportedPdfFormatException.class);
        verifyNoInteractions(ocrGateway, objectStore);
    }

    @Test
    void emptyDocumentFailsValidationWithCode() {
        assertThatThrownBy(() -> orchestrator(PipelinePropertiesFixtures.extraction()).extract("input/empty.pdf", 0))
                .isInstanceOfSatisfying(DocumentValidationException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo("EMPTY_DOCUMENT"));
    }

    /**
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void lowQualityIsFlaggedOrRejectedDependingOnGate() throws Exception {
        byte[] pdf = SamplePdfs.create(null, "blurry");
        BDDMockito.given(objectStore.download(any())).willReturn(pdf);
        BDDMockito.given(ocrGateway.detectText(pdf)).willReturn(new OcrDocument(List.of(
                new OcrBlock(OcrBlockType.LINE, "blurry", 40f, 1, 0f, 0f)
        ), 1));

        ExtractionResult flagged = orchestrator(PipelinePropertiesFixtures.extraction())
                .extract("input/blurry.pdf", pdf.length);
        assertThat(flagged.highQuality()).isFalse();

        ExtractionOrchestrator gated = orchestrator(PipelinePropertiesFixtures.extraction(Duration.ofSeconds(300), true));
        assertThatThrownBy(() -> gated.extract("input/blurry.pdf", pdf.length))
                .isInstanceOf(ExtractionQualityException.class);
    }

    private void stored(String key, long size) {
        BDDMockito.given(objectStore.describe(key))
                .willReturn(Optional.of(new StoredObject(key, size, "application/pdf", CLOCK.instant())));
    }

    private ExtractionOrchestrator orchestrator(PipelineProperties.Extraction extraction) {
        PipelineProperties properties = PipelinePropertiesFixtures.withExtraction(extraction);
        return new ExtractionOrchestrator(
                objectStore,
                ocrGateway,
                new DocumentValidator(objectStore, properties),
                new PdfBoxDocumentInspector(),
                properties,
                CLOCK
        );
    }
}
