package dev.orderscanner.email;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.orderscanner.exception.RateLimitedException;
import dev.orderscanner.exception.UpstreamAuthException;
import dev.orderscanner.metrics.IngestionMetrics;
import dev.orderscanner.model.RawEmail;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * EmailProvider backed by the Gmail REST API.
 */
@Slf4j
@Component
public class GmailEmailProvider implements EmailProvider {

    private final WebClient webClient;
    private final AccessTokenStore accessTokenStore;
    private final IngestionMetrics metrics;

    public GmailEmailProvider(
            WebClient.Builder webClientBuilder,
            AccessTokenStore accessTokenStore,
            IngestionMetrics metrics,
            @Value("${app.gmail.base-url:https://gmail.googleapis.com/gmail/v1/users/me}") String baseUrl) {
        this.webClient = webClientBuilder
                .baseUrl(Objects.requireNonNull(baseUrl))
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .defaultHeader("Accept", "application/json")
                .build();
        this.accessTokenStore = accessTokenStore;
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return "Gmail";
    }

    @Override
    public Mono<List<String>> search(String ownerKey, String query, int maxResults) {
        log.info("Searching Gmail for {} with query: \"{}\" (max: {})", ownerKey, query, maxResults);
        return withToken(ownerKey, token -> timed(webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/messages")
                        .queryParam("q", "{q}")
                        .queryParam("maxResults", maxResults)
                        .build(query))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.UNAUTHORIZED.value(),
                        response -> Mono.error(new UpstreamAuthException()))
                .onStatus(status -> status.value() == HttpStatus.TOO_MANY_REQUESTS.value(),
                        response -> Mono.error(new RateLimitedException("Gmail rate limit exceeded (429)")))
                .bodyToMono(MessageList.class)))
                .map(list -> list.messages() == null
                        ? List.<String>of()
                        : list.messages().stream().map(MessageRef::id).filter(Objects::nonNull).toList())
                .doOnNext(ids -> log.info("Found {} messages matching query", ids.size()));
    }

    @Override
    public Mono<RawEmail> fetch(String ownerKey, String messageId) {
        return withToken(ownerKey, token -> timed(webClient.get()
                .uri("/messages/{id}?format=full", messageId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.UNAUTHORIZED.value(),
                        response -> Mono.error(new UpstreamAuthException()))
                .onStatus(status -> status.value() == HttpStatus.TOO_MANY_REQUESTS.value(),
                        response -> Mono.error(new RateLimitedException("Gmail rate limit exceeded (429)")))
                .bodyToMono(GmailMessage.class)))
                .map(this::toRawEmail);
    }

    private <T> Mono<T> withToken(String ownerKey, Function<String, Mono<T>> call) {
        return Mono.defer(() -> accessTokenStore.findToken(ownerKey)
                .map(call)
                .orElseGet(() -> Mono.error(new UpstreamAuthException())));
    }

    private <T> Mono<T> timed(Mono<T> call) {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return call.timeout(Duration.ofSeconds(30))
                    .doOnTerminate(() -> metrics.recordFetchLatency(getName(), System.currentTimeMillis() - start));
        });
    }

    RawEmail toRawEmail(GmailMessage message) {
        Payload payload = message.payload();
        List<Header> headers = payload != null && payload.headers() != null ? payload.headers() : List.of();

        String body = "";
        if (payload != null && payload.body() != null && payload.body().data() != null) {
            body = toText(payload.mimeType(), decode(payload.body().data()));
        } else if (payload != null && payload.parts() != null) {
            body = findBody(payload.parts());
        }
        if (body.isBlank() && message.snippet() != null) {
            body = message.snippet();
        }

        return RawEmail.builder()
                .id(message.id())
                .subject(header(headers, "Subject", "(No Subject)"))
                .sender(header(headers, "From", "Unknown Sender"))
                .date(header(headers, "Date", ""))
                .snippet(message.snippet() != null ? message.snippet() : "")
                .body(body)
                .build();
    }

    /**
     * Prefer a text/plain part anywhere in the tree, otherwise the first
     * text/html part reduced to text.
     */
    private String findBody(List<Part> parts) {
        String plain = findPart(parts, "text/plain");
        if (plain != null) {
            return decode(plain);
        }
        String html = findPart(parts, "text/html");
        return html != null ? stripHtml(decode(html)) : "";
    }

    private String findPart(List<Part> parts, String mimeType) {
        for (Part part : parts) {
            if (mimeType.equalsIgnoreCase(part.mimeType()) && part.body() != null && part.body().data() != null) {
                return part.body().data();
            }
            if (part.parts() != null) {
                String nested = findPart(part.parts(), mimeType);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    private String toText(String mimeType, String content) {
        return "text/html".equalsIgnoreCase(mimeType) ? stripHtml(content) : content;
    }

    private String decode(String data) {
        try {
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("Failed to decode message body: {}", e.getMessage());
            return "";
        }
    }

    private String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    private String header(List<Header> headers, String name, String fallback) {
        return headers.stream()
                .filter(h -> name.equalsIgnoreCase(h.name()))
                .map(Header::value)
                .filter(v -> v != null && !v.isBlank())
                .findFirst()
                .orElse(fallback);
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageList(List<MessageRef> messages, Integer resultSizeEstimate) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageRef(String id, String threadId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GmailMessage(String id, String snippet, Payload payload) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Payload(String mimeType, List<Header> headers, Body body, List<Part> parts) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String mimeType, Body body, List<Part> parts) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Header(String name, String value) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Body(String data) {
    }
}
