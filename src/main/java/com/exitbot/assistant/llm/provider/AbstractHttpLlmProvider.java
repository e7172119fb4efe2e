package com.exitbot.assistant.llm.provider;

import com.exitbot.assistant.config.LlmProperties;
import com.exitbot.assistant.exception.ErrorKind;
import com.exitbot.assistant.exception.LlmException;
import com.exitbot.assistant.llm.LlmProvider;
import com.exitbot.assistant.model.LlmRequest;
import com.exitbot.assistant.model.LlmResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Common request/translate cycle for JSON-over-HTTP providers.
 * Subclasses supply the endpoint, the request body and the response parsing;
 * every failure leaves as an {@link LlmException}.
 */
@Slf4j
public abstract class AbstractHttpLlmProvider implements LlmProvider {

    protected final String providerName;
    protected final LlmProperties.Provider props;
    protected final RestClient restClient;

    protected AbstractHttpLlmProvider(String providerName,
                                      LlmProperties.Provider props,
                                      RestClient restClient) {
        this.providerName = providerName;
        this.props = props;
        this.restClient = restClient;
    }

    @Override
    public String getName() {
        return providerName;
    }

    @Override
    public LlmResponse invoke(LlmRequest request) {
        checkCredentials();

        Map<String, Object> body = buildRequestBody(request);
        log.debug("Sending {} messages to {} [model={}]",
                request.getMessages().size(), providerName, body.get("model"));

        long start = System.nanoTime();
        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri(endpoint())
                    .body(body)
                    .retrieve()
                    .body(new ParameterizedTypeReference<>() {});
        } catch (RestClientException e) {
            throw HttpErrorClassifier.classify(providerName, e);
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;

        if (response == null) {
            throw malformed("empty response body");
        }
        try {
            return parseResponse(response).toBuilder()
                    .provider(providerName)
                    .latencyMs(latencyMs)
                    .build();
        } catch (ClassCastException e) {
            throw new LlmException(ErrorKind.UNKNOWN, providerName,
                    providerName + " returned an unexpected payload shape", e);
        }
    }

    protected abstract String endpoint();

    protected abstract Map<String, Object> buildRequestBody(LlmRequest request);

    protected abstract LlmResponse parseResponse(Map<String, Object> response);

    /** Cloud adapters override to fail fast without a network call. */
    protected void checkCredentials() {
    }

    protected String resolveModel(LlmRequest request) {
        return request.getModel() != null ? request.getModel() : props.getModel();
    }

    protected double resolveTemperature(LlmRequest request) {
        return request.getTemperature() != null ? request.getTemperature() : props.getTemperature();
    }

    protected int resolveMaxTokens(LlmRequest request) {
        return request.getMaxTokens() != null ? request.getMaxTokens() : props.getMaxTokens();
    }

    protected LlmException malformed(String detail) {
        log.error("{} returned a malformed response: {}", providerName, detail);
        return new LlmException(ErrorKind.UNKNOWN, providerName,
                providerName + " returned a malformed response: " + detail);
    }

    protected static int intValue(Map<String, Object> map, String key) {
        if (map == null) return 0;
        Object value = map.get(key);
        return value instanceof Number n ? n.intValue() : 0;
    }
}
