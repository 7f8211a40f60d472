package com.example.pdfocr.infrastructure.pdf;

import com.example.pdfocr.domain.model.PdfDocumentInfo;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Calendar;
import java.util.Optional;

/**
 * Infrastructure service that reads PDF structure locally with PDFBox before the bytes go to the OCR service.
 * Hides the PDFBox parsing details from the rest of the application.
 */
@Service
public class PdfBoxDocumentInspector {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentInspector.class);
    private static final byte[] PDF_SIGNATURE = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final DateTimeFormatter CALENDAR_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    /**
     * Checks the leading bytes for the PDF header.
     *
     * @param bytes document content
     * @return {@code true} when the content starts with {@code %PDF-}
     */
    public boolean hasPdfSignature(byte[] bytes) {
        if (bytes == null || bytes.length < PDF_SIGNATURE.length) {
            return false;
        }
        return Arrays.equals(Arrays.copyOf(bytes, PDF_SIGNATURE.length), PDF_SIGNATURE);
    }

    /**
     * Loads the document and maps its page count and info dictionary.
     * A document PDFBox cannot open is not an error here: the OCR service has the final word.
     *
     * @param bytes document content
     * @return structured details, empty when PDFBox cannot read the document
     */
    public Optional<PdfDocumentInfo> inspect(byte[] bytes) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            return Optional.of(readInfo(document, bytes.length));
        } catch (IOException ex) {
            log.warn("Unable to inspect PDF structure: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Extracts the info dictionary fields and structural flags from an open document.
     *
     * @param document      already opened PDF document
     * @param fileSizeBytes size of the source bytes
     * @return mapped domain DTO
     */
    private PdfDocumentInfo readInfo(PDDocument document, long fileSizeBytes) {
        PDDocumentInformation info = document.getDocumentInformation();
        return new PdfDocumentInfo(
                info != null ? info.getTitle() : null,
                info != null ? info.getAuthor() : null,
                info != null ? info.getSubject() : null,
                info != null ? info.getCreator() : null,
                info != null ? info.getProducer() : null,
                info != null ? formatCalendar(info.getCreationDate()) : null,
                document.getNumberOfPages(),
                String.valueOf(document.getVersion()),
                document.isEncrypted(),
                fileSizeBytes
        );
    }

    /**
     * Formats a {@link Calendar} value into a stable UTC representation.
     *
     * @param calendar calendar coming from PDFBox metadata
     * @return formatted string or {@code null}
     */
    private String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return CALENDAR_FORMATTER.format(calendar.toInstant().atZone(ZoneOffset.UTC));
    }
}
