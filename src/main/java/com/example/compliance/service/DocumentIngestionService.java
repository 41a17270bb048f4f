package com.example.compliance.service;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.exception.IngestionException;
import com.example.compliance.model.RawDoc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads procedure documents into {@link RawDoc}s.
 * <p>
 * Plain text and Markdown are decoded locally as strict UTF-8. PDFs are sent to the external
 * extraction service, when one is configured. A document that cannot be read is reported in
 * {@link Result#failures()} and does not stop the others.
 */
@Service
public class DocumentIngestionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);

    /** Outcome of one ingestion pass. */
    public record Result(List<RawDoc> documents, List<IngestionException> failures) {
    }

    private final RestClient restClient;

    public DocumentIngestionService(ComplianceProperties properties) {
        if (properties.extractionService().enabled()) {
            // Generous timeout: extraction of large PDFs can take minutes
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(Duration.ofSeconds(30));
            factory.setReadTimeout(Duration.ofMinutes(5));
            this.restClient = RestClient.builder()
                    .baseUrl(properties.extractionService().baseUrl())
                    .requestFactory(factory)
                    .build();
        } else {
            this.restClient = null;
        }
    }

    /** Reads every path, in the given order. */
    public Result ingest(List<Path> paths) {
        List<RawDoc> documents = new ArrayList<>();
        List<IngestionException> failures = new ArrayList<>();
        for (Path path : paths) {
            try {
                documents.add(read(path));
            } catch (IngestionException e) {
                log.warn("Ingestion failed for '{}': {}", path, e.getMessage());
                failures.add(e);
            }
        }
        log.info("Ingested {} document(s), {} failure(s)", documents.size(), failures.size());
        return new Result(documents, failures);
    }

    /**
     * @throws IngestionException if the file is missing, unsupported or cannot be decoded
     */
    public RawDoc read(Path path) {
        String name = path.toString();
        if (!Files.isRegularFile(path)) {
            throw new IngestionException(name, "File not found: " + name);
        }
        String extension = extensionOf(path);
        byte[] bytes;
        long lastModified;
        try {
            bytes = Files.readAllBytes(path);
            lastModified = Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new IngestionException(name, "Unable to read file: " + e.getMessage(), e);
        }

        String text = switch (extension) {
            case "txt", "md" -> decodeUtf8(name, bytes);
            case "pdf" -> extractPdf(name, path.getFileName().toString(), bytes);
            default -> throw new IngestionException(name,
                    "Unsupported file type '." + extension + "'. Supported: .txt, .md, .pdf");
        };
        log.debug("Read '{}' ({} bytes, {} characters)", name, bytes.length, text.length());
        return new RawDoc(name, Hashes.sha256(bytes), lastModified, text);
    }

    /**
     * Checks whether the extraction service is configured and reachable.
     */
    public boolean isServiceAvailable() {
        if (restClient == null) return false;
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> health = restClient.get()
                    .uri("/health")
                    .retrieve()
                    .body(Map.class);
            return health != null && "ok".equals(health.get("status"));
        } catch (RestClientException e) {
            log.warn("PDF extraction service not available: {}", e.getMessage());
            return false;
        }
    }

    private String extractPdf(String name, String filename, byte[] bytes) {
        if (restClient == null) {
            throw new IngestionException(name,
                    "PDF input requires the extraction service (compliance.extraction-service.base-url)");
        }
        log.info("Sending PDF '{}' ({} bytes) to extraction service", filename, bytes.length);

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(bytes) {
            @Override
            public String getFilename() {
                return filename;
            }
        });
        body.add("mode", "full");

        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> response = restClient.post()
                    .uri("/extract")
                    .body(body)
                    .retrieve()
                    .body(Map.class);

            if (response != null && Boolean.TRUE.equals(response.get("success"))
                    && response.get("text") instanceof String text) {
                log.info("Extraction completed: {} characters extracted", text.length());
                return text;
            }
            String error = response != null ? response.toString() : "null response from service";
            throw new IngestionException(name, "PDF extraction failed: " + error);
        } catch (RestClientException e) {
            throw new IngestionException(name,
                    "PDF extraction service unreachable. Ensure it is running on the configured URL. Details: "
                            + e.getMessage(), e);
        }
    }

    private static String decodeUtf8(String name, byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IngestionException(name, "File is not valid UTF-8 text", e);
        }
    }

    private static String extensionOf(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
