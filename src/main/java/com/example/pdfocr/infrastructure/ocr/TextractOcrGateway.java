package com.example.pdfocr.infrastructure.ocr;

import com.example.pdfocr.domain.exception.DocumentValidationException;
import com.example.pdfocr.domain.model.OcrBlock;
import com.example.pdfocr.domain.model.OcrBlockType;
import com.example.pdfocr.domain.model.OcrDocument;
import com.example.pdfocr.domain.model.OcrJobPage;
import com.example.pdfocr.domain.model.OcrJobStatus;
import com.example.pdfocr.domain.port.OcrGateway;
import com.example.pdfocr.infrastructure.exception.OcrServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.BadDocumentException;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BoundingBox;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Document;
import software.amazon.awssdk.services.textract.model.DocumentLocation;
import software.amazon.awssdk.services.textract.model.DocumentMetadata;
import software.amazon.awssdk.services.textract.model.DocumentTooLargeException;
import software.amazon.awssdk.services.textract.model.GetDocumentTextDetectionRequest;
import software.amazon.awssdk.services.textract.model.GetDocumentTextDetectionResponse;
import software.amazon.awssdk.services.textract.model.JobStatus;
import software.amazon.awssdk.services.textract.model.S3Object;
import software.amazon.awssdk.services.textract.model.StartDocumentTextDetectionRequest;
import software.amazon.awssdk.services.textract.model.UnsupportedDocumentException;

import java.util.List;

/**
 * {@link OcrGateway} backed by Amazon Textract text detection.
 * Documents Textract refuses to read are reported as validation failures since resubmitting them cannot help.
 */
@Component
public class TextractOcrGateway implements OcrGateway {

    private static final Logger log = LoggerFactory.getLogger(TextractOcrGateway.class);

    private final TextractClient textractClient;

    public TextractOcrGateway(TextractClient textractClient) {
        this.textractClient = textractClient;
    }

    @Override
    public OcrDocument detectText(byte[] document) {
        try {
            DetectDocumentTextResponse response = textractClient.detectDocumentText(DetectDocumentTextRequest.builder()
                    .document(Document.builder().bytes(SdkBytes.fromByteArray(document)).build())
                    .build());
            List<OcrBlock> blocks = toBlocks(response.blocks());
            log.debug("Synchronous detection returned {} blocks", blocks.size());
            return new OcrDocument(blocks, pages(response.documentMetadata()));
        } catch (SdkException ex) {
            throw translate("detect document text", ex);
        }
    }

    @Override
    public String startTextDetection(String bucket, String key) {
        try {
            String jobId = textractClient.startDocumentTextDetection(StartDocumentTextDetectionRequest.builder()
                    .documentLocation(DocumentLocation.builder()
                            .s3Object(S3Object.builder().bucket(bucket).name(key).build())
                            .build())
                    .build()).jobId();
            log.info("Started text detection job {} for s3://{}/{}", jobId, bucket, key);
            return jobId;
        } catch (SdkException ex) {
            throw translate("start text detection for " + key, ex);
        }
    }

    @Override
    public OcrJobPage getTextDetection(String jobId, String nextToken) {
        try {
            GetDocumentTextDetectionResponse response = textractClient.getDocumentTextDetection(
                    GetDocumentTextDetectionRequest.builder()
                            .jobId(jobId)
                            .nextToken(nextToken)
                            .build());
            return new OcrJobPage(
                    toStatus(response.jobStatus()),
                    response.statusMessage(),
                    toBlocks(response.blocks()),
                    pages(response.documentMetadata()),
                    response.nextToken()
            );
        } catch (SdkException ex) {
            throw translate("read text detection job " + jobId, ex);
        }
    }

    private OcrJobStatus toStatus(JobStatus status) {
        if (status == null) {
            throw new OcrServiceException("Text detection response carried no job status", null, null);
        }
        return switch (status) {
            case IN_PROGRESS -> OcrJobStatus.IN_PROGRESS;
            case SUCCEEDED -> OcrJobStatus.SUCCEEDED;
            case PARTIAL_SUCCESS -> OcrJobStatus.PARTIAL_SUCCESS;
            case FAILED -> OcrJobStatus.FAILED;
            default -> throw new OcrServiceException("Unknown text detection job status: " + status, null, null);
        };
    }

    private List<OcrBlock> toBlocks(List<Block> blocks) {
        if (blocks == null) {
            return List.of();
        }
        return blocks.stream().map(this::toBlock).toList();
    }

    private OcrBlock toBlock(Block block) {
        float top = 0f;
        float left = 0f;
        if (block.geometry() != null && block.geometry().boundingBox() != null) {
            BoundingBox box = block.geometry().boundingBox();
            top = box.top() != null ? box.top() : 0f;
            left = box.left() != null ? box.left() : 0f;
        }
        return new OcrBlock(
                toType(block),
                block.text(),
                block.confidence(),
                // synchronous responses omit the page number
                block.page() != null ? block.page() : 1,
                top,
                left
        );
    }

    private OcrBlockType toType(Block block) {
        if (block.blockType() == null) {
            return OcrBlockType.OTHER;
        }
        return switch (block.blockType()) {
            case PAGE -> OcrBlockType.PAGE;
            case LINE -> OcrBlockType.LINE;
            case WORD -> OcrBlockType.WORD;
            default -> OcrBlockType.OTHER;
        };
    }

    private Integer pages(DocumentMetadata metadata) {
        return metadata != null ? metadata.pages() : null;
    }

    private RuntimeException translate(String operation, SdkException ex) {
        if (ex instanceof UnsupportedDocumentException
                || ex instanceof BadDocumentException
                || ex instanceof DocumentTooLargeException) {
            log.warn("Textract rejected the document while trying to {}: {}", operation, ex.getMessage());
        }
        if (ex instanceof UnsupportedDocumentException) {
            return new DocumentValidationException("Textract does not support this document format", "UNSUPPORTED_DOCUMENT");
        }
        if (ex instanceof BadDocumentException) {
            return new DocumentValidationException("Textract could not read the document", "BAD_DOCUMENT");
        }
        if (ex instanceof DocumentTooLargeException) {
            return new DocumentValidationException("Document exceeds the Textract size limits", "DOCUMENT_TOO_LARGE");
        }
        String errorCode = null;
        if (ex instanceof AwsServiceException serviceException && serviceException.awsErrorDetails() != null) {
            errorCode = serviceException.awsErrorDetails().errorCode();
        }
        log.error("Textract call failed: {}", operation, ex);
        return new OcrServiceException("Failed to " + operation + ": " + ex.getMessage(), errorCode, ex);
    }
}
