package io.github.yok.crmexport.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import io.github.resilience4j.retry.Retry;
import io.github.yok.crmexport.config.ApiConfig;
import java.net.URI;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Issues authenticated JSON requests against the CRM API.
 *
 * <p>
 * Each request is wrapped in the transport {@link Retry}: transient failures are retried with a
 * fixed delay and the last failure is escalated as a {@link TransportException} once the attempt
 * budget is spent. The client keeps no state between calls.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class CrmTransportClient {

    private final ApiConfig apiConfig;
    private final RestTemplate restTemplate;
    private final Retry retry;
    private final ObjectMapper objectMapper;

    /**
     * Creates a client.
     *
     * @param apiConfig base URL, token and timeouts
     * @param restTemplate HTTP client
     * @param retry retry policy for transient failures
     * @param objectMapper JSON parser for response bodies
     */
    public CrmTransportClient(ApiConfig apiConfig, RestTemplate restTemplate, Retry retry,
            ObjectMapper objectMapper) {
        this.apiConfig = Preconditions.checkNotNull(apiConfig, "apiConfig must not be null");
        this.restTemplate =
                Preconditions.checkNotNull(restTemplate, "restTemplate must not be null");
        this.retry = Preconditions.checkNotNull(retry, "retry must not be null");
        this.objectMapper =
                Preconditions.checkNotNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Sends a request and returns the parsed JSON body.
     *
     * @param method HTTP method
     * @param path path below the base URL (e.g. {@code /crm/v3/objects/contacts})
     * @param params query parameters; entries with a null value are omitted
     * @return parsed body; an empty object node when the body is empty
     * @throws TransportException when the request fails terminally
     */
    public JsonNode request(HttpMethod method, String path, Map<String, ?> params) {
        URI uri = buildUri(path, params);
        HttpEntity<Void> entity = new HttpEntity<>(buildHeaders());

        ResponseEntity<String> response;
        try {
            response = retry.executeSupplier(() -> {
                log.info("Making {} request to {}", method, uri.getPath());
                ResponseEntity<String> r = restTemplate.exchange(uri, method, entity, String.class);
                log.info("Request successful: {}", r.getStatusCode().value());
                return r;
            });
        } catch (RestClientException e) {
            throw new TransportException(
                    String.format("%s %s failed: %s", method, uri.getPath(), e.getMessage()), e);
        }

        String body = response.getBody();
        if (StringUtils.isBlank(body)) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportException(
                    String.format("%s %s returned an unparseable body", method, uri.getPath()), e);
        }
    }

    /**
     * Shorthand for a GET request.
     *
     * @param path path below the base URL
     * @param params query parameters
     * @return parsed body
     */
    public JsonNode get(String path, Map<String, ?> params) {
        return request(HttpMethod.GET, path, params);
    }

    URI buildUri(String path, Map<String, ?> params) {
        String baseUrl = StringUtils.removeEnd(apiConfig.getBaseUrl(), "/");
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl).path(path);
        if (params != null) {
            params.forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, value);
                }
            });
        }
        return builder.build().encode().toUri();
    }

    private HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiConfig.requireAccessToken());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }
}
