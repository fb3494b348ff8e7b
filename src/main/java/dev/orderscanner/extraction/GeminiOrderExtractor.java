package dev.orderscanner.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.orderscanner.exception.ExtractionException;
import dev.orderscanner.exception.ExtractionUnavailableException;
import dev.orderscanner.model.ExtractedOrder;
import dev.orderscanner.model.LineItem;
import dev.orderscanner.model.RawEmail;
import dev.orderscanner.support.EmailDates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * OrderExtractor backed by the Google AI Studio (Gemini) REST API with a
 * structured JSON response schema.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiOrderExtractor implements OrderExtractor {

    static final String UNKNOWN_SUPPLIER = "Unknown Supplier";
    static final double DEFAULT_CONFIDENCE = 0.95;
    private static final int MAX_BODY_LENGTH = 12000;

    private static final Map<String, Object> ORDER_SCHEMA = Map.of(
            "type", "OBJECT",
            "properties", Map.of(
                    "isOrder", Map.of("type", "BOOLEAN",
                            "description", "True if this email is a receipt, invoice, or order confirmation."),
                    "supplier", Map.of("type", "STRING", "description", "The name of the vendor or supplier."),
                    "orderDate", Map.of("type", "STRING",
                            "description", "Date of the order in ISO 8601 format (YYYY-MM-DD)."),
                    "totalAmount", Map.of("type", "NUMBER", "description", "Total numerical value of the order."),
                    "items", Map.of(
                            "type", "ARRAY",
                            "items", Map.of(
                                    "type", "OBJECT",
                                    "properties", Map.of(
                                            "name", Map.of("type", "STRING",
                                                    "description", "Clean, standardized name of the product."),
                                            "quantity", Map.of("type", "NUMBER",
                                                    "description", "Numeric quantity purchased."),
                                            "unit", Map.of("type", "STRING",
                                                    "description", "Unit of measure (e.g., box, case, each, lbs)."),
                                            "unitPrice", Map.of("type", "NUMBER", "description", "Price per unit."),
                                            "sku", Map.of("type", "STRING",
                                                    "description", "Supplier part number or SKU, if present."))))),
            "required", List.of("isOrder"));

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final String geminiPath;
    private final int maxRetries;
    private final Duration retryBackoff;

    public GeminiOrderExtractor(
            ObjectMapper objectMapper,
            @Value("${app.ai.gemini.api-key}") String apiKey,
            @Value("${app.ai.gemini.model:gemini-2.0-flash}") String model,
            @Value("${app.ai.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.ai.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath,
            @Value("${app.ai.gemini.max-retries:3}") int maxRetries,
            @Value("${app.ai.gemini.retry-backoff:PT2S}") Duration retryBackoff) {
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API Key is missing! Order extraction will fail.");
        } else {
            log.info("Gemini order extraction enabled with model: {} (Key present)", this.model);
        }
    }

    @Override
    public Mono<ExtractedOrder> extract(RawEmail email) {
        if (!isEnabled()) {
            return Mono.error(new ExtractionUnavailableException("Gemini API key is missing", null));
        }

        GeminiRequest request = buildRequest(buildPrompt(email));
        String uri = String.format(geminiPath, model) + "?key=" + apiKey;

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(Objects.requireNonNull(request))
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .timeout(Duration.ofSeconds(60))
                .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                        .filter(this::isRetryableError)
                        .doBeforeRetry(signal -> log.info("Retrying extraction for email {} (Attempt {})",
                                email.getId(), signal.totalRetries() + 1))
                        .onRetryExhaustedThrow((spec, signal) -> new ExtractionUnavailableException(
                                "Extraction service unavailable after " + signal.totalRetries() + " retries",
                                signal.failure())))
                .onErrorMap(e -> !(e instanceof ExtractionException), this::translateError)
                .flatMap(response -> Mono.justOrEmpty(toOrder(email, extractContent(response))));
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    private String buildPrompt(RawEmail email) {
        String body = email.getBody() == null ? "" : email.getBody();
        if (body.length() > MAX_BODY_LENGTH) {
            body = body.substring(0, MAX_BODY_LENGTH) + "...";
        }

        return String.format(
                """
                        Analyze the following email content. Determine if it is a purchase order, receipt, or invoice.
                        If it is, extract the supplier, date, and line items.

                        Subject: %s
                        Sender: %s
                        Date Header: %s
                        Body:
                        %s
                        """,
                email.getSubject(), email.getSender(), email.getDate(), body);
    }

    private GeminiRequest buildRequest(String prompt) {
        return new GeminiRequest(List.of(
                new GeminiRequest.Content(List.of(
                        new GeminiRequest.Part(prompt)))),
                new GeminiRequest.GenerationConfig(0.1, 8192, "application/json", ORDER_SCHEMA));
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            log.warn("Gemini returned no candidates or null response");
            return null;
        }

        var candidate = response.candidates().get(0);
        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }
        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            log.warn("Gemini candidate has no content parts. Finish reason: {}", candidate.finishReason());
            return null;
        }
        return candidate.content().parts().get(0).text();
    }

    ExtractedOrder toOrder(RawEmail email, String text) {
        if (text == null || text.isBlank()) {
            return null;
        }

        OrderPayload payload;
        try {
            payload = objectMapper.readValue(text, OrderPayload.class);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Unparseable extraction output for email " + email.getId(), e);
        }

        if (!Boolean.TRUE.equals(payload.isOrder())) {
            log.debug("Email {} is not an order", email.getId());
            return null;
        }

        List<LineItem> items = payload.items() == null ? List.of() : payload.items().stream()
                .filter(item -> item.name() != null && !item.name().isBlank())
                .map(item -> LineItem.builder()
                        .name(item.name().trim())
                        .normalizedName(LineItem.normalize(item.name()))
                        .quantity(item.quantity() != null && item.quantity() > 0 ? item.quantity() : 1)
                        .unit(item.unit() != null ? item.unit() : "each")
                        .unitPrice(item.unitPrice())
                        .sku(item.sku())
                        .build())
                .toList();

        return ExtractedOrder.builder()
                .id("order_" + UUID.randomUUID())
                .originalEmailId(email.getId())
                .supplier(payload.supplier() != null && !payload.supplier().isBlank()
                        ? payload.supplier() : UNKNOWN_SUPPLIER)
                .orderDate(EmailDates.parse(payload.orderDate())
                        .or(() -> EmailDates.parse(email.getDate()))
                        .orElse(null))
                .totalAmount(payload.totalAmount())
                .items(items)
                .confidence(DEFAULT_CONFIDENCE)
                .build();
    }

    private boolean isRetryableError(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return e instanceof WebClientRequestException || e instanceof TimeoutException;
    }

    private Throwable translateError(Throwable e) {
        if (isRetryableError(e)) {
            return new ExtractionUnavailableException("Extraction service unavailable: " + e.getMessage(), e);
        }
        return new ExtractionException("Extraction failed: " + e.getMessage(), e);
    }

    // Request DTOs
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens,
                                String responseMimeType, Map<String, Object> responseSchema) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(
                Content content,
                String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }

    // Structured output
    @JsonIgnoreProperties(ignoreUnknown = true)
    record OrderPayload(@JsonProperty("isOrder") Boolean isOrder, String supplier, String orderDate,
                        Double totalAmount, List<ItemPayload> items) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemPayload(String name, Double quantity, String unit, Double unitPrice, String sku) {
    }
}
