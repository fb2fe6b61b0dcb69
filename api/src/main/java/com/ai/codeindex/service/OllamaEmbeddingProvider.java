package com.ai.codeindex.service;

import com.ai.codeindex.config.EmbeddingProperties;
import com.ai.codeindex.credential.Credential;
import com.ai.codeindex.credential.CredentialSupervisor;
import com.ai.codeindex.exception.CredentialUnavailableException;
import com.ai.codeindex.exception.EmbeddingProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Batched embeddings from an Ollama-compatible {@code /api/embed} endpoint, authenticated
 * with the supervisor's bearer token.
 */
@Service
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);

    private final WebClient webClient;
    private final CredentialSupervisor credentials;
    private final EmbeddingProperties properties;

    public OllamaEmbeddingProvider(WebClient embeddingWebClient, CredentialSupervisor credentials,
                                   EmbeddingProperties properties) {
        this.webClient = embeddingWebClient;
        this.credentials = credentials;
        this.properties = properties;
    }

    @Override
    public String modelId() {
        return properties.getModel();
    }

    @Override
    public int maxBatchSize() {
        return Math.max(1, properties.getBatchSize());
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        Credential credential = credentials.getActiveCredential();
        try {
            return call(texts, credential);
        } catch (WebClientResponseException e) {
            if (!isAuthRejection(e)) {
                throw translate(e);
            }
            log.warn("[EmbeddingProvider] Credential rejected ({}), refreshing once", e.getStatusCode());
            credentials.reportRejected(credential);
        }

        Credential retried = credentials.getActiveCredential();
        try {
            return call(texts, retried);
        } catch (WebClientResponseException e) {
            if (isAuthRejection(e)) {
                credentials.reportRejected(retried);
                throw new CredentialUnavailableException("Embedding endpoint rejected a freshly refreshed credential ("
                        + e.getStatusCode() + ")", e);
            }
            throw translate(e);
        }
    }

    private List<float[]> call(List<String> texts, Credential credential) {
        EmbedResponse response;
        try {
            response = webClient.post()
                    .uri("/api/embed")
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> h.setBearerAuth(credential.token()))
                    .bodyValue(Map.of("model", properties.getModel(), "input", texts))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .timeout(properties.getCallTimeout())
                    .retryWhen(Retry.backoff(properties.getMaxRetries(), properties.getRetryBackoff())
                            .filter(OllamaEmbeddingProvider::isTransient)
                            .doBeforeRetry(s -> log.warn("[EmbeddingProvider] Retry #{} after: {}",
                                    s.totalRetries() + 1, s.failure().getMessage()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
        } catch (WebClientResponseException e) {
            throw e;
        } catch (WebClientRequestException e) {
            log.error("[EmbeddingProvider] Failed to connect: {}", e.getMessage());
            throw new EmbeddingProviderException("Embedding endpoint is not reachable at " + properties.getBaseUrl(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new EmbeddingProviderException("Embedding call timed out after "
                        + properties.getCallTimeout().toMillis() + " ms", cause, true);
            }
            throw new EmbeddingProviderException("Failed to generate embeddings: " + cause.getMessage(), cause);
        }

        if (response == null || response.embeddings() == null || response.embeddings().size() != texts.size()) {
            int got = response == null || response.embeddings() == null ? 0 : response.embeddings().size();
            throw new EmbeddingProviderException("Expected " + texts.size() + " embeddings, got " + got);
        }
        log.debug("[EmbeddingProvider] Embedded {} texts with {}", texts.size(), properties.getModel());
        return response.embeddings();
    }

    private static boolean isTransient(Throwable t) {
        if (t instanceof WebClientResponseException e) {
            return e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
        }
        return t instanceof WebClientRequestException || t instanceof TimeoutException;
    }

    private static boolean isAuthRejection(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        return status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value();
    }

    private EmbeddingProviderException translate(WebClientResponseException e) {
        log.error("[EmbeddingProvider] Endpoint returned error: status={}, body={}", e.getStatusCode(),
                e.getResponseBodyAsString());
        if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return new EmbeddingProviderException("Embedding endpoint not found (404); check the model '"
                    + properties.getModel() + "' and the endpoint version", e);
        }
        return new EmbeddingProviderException("Embedding endpoint returned " + e.getStatusCode(), e);
    }

    /**
     * Response of /api/embed.
     */
    record EmbedResponse(List<float[]> embeddings) {
    }
}
