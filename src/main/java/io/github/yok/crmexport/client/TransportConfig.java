package io.github.yok.crmexport.client;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.yok.crmexport.config.ApiConfig;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Builds the HTTP client and the retry policy used by {@link CrmTransportClient}.
 *
 * <p>
 * Retry policy: fixed delay of {@code crm.retry.delay-seconds} between at most
 * {@code crm.retry.max-attempts} attempts. Network failures, timeouts, 5xx and 429 are retried;
 * 429 gets the same delay as every other transient failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Configuration
public class TransportConfig {

    static final String RETRY_NAME = "crmTransport";

    /**
     * RestTemplate backed by Apache HttpClient 5 with connect and response timeouts.
     *
     * @param apiConfig API settings
     * @return configured RestTemplate
     */
    @Bean
    public RestTemplate crmRestTemplate(ApiConfig apiConfig) {
        Timeout timeout = Timeout.ofSeconds(apiConfig.getTimeoutSeconds());

        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(timeout)
                .setSocketTimeout(timeout)
                .build());

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(cm)
                .setDefaultRequestConfig(RequestConfig.custom().setResponseTimeout(timeout).build())
                .build();

        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
    }

    /**
     * Fixed-delay retry applied to every API request.
     *
     * @param apiConfig API settings
     * @return retry instance
     */
    @Bean
    public Retry crmTransportRetry(ApiConfig apiConfig) {
        return createRetry(apiConfig.getRetry().getMaxAttempts(),
                Duration.ofSeconds(apiConfig.getRetry().getDelaySeconds()));
    }

    /**
     * Creates the transport retry with event logging attached.
     *
     * @param maxAttempts total attempts including the first call
     * @param delay fixed wait between attempts
     * @return retry instance
     */
    public static Retry createRetry(int maxAttempts, Duration delay) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(delay)
                .retryOnException(TransportConfig::isTransient)
                .build();

        Retry retry = Retry.of(RETRY_NAME, config);
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Request failed: {}. Retrying in {} ms (attempt {}/{})",
                        event.getLastThrowable().getMessage(),
                        event.getWaitInterval().toMillis(),
                        event.getNumberOfRetryAttempts(), maxAttempts))
                .onSuccess(event -> log.info("Request succeeded after {} retries",
                        event.getNumberOfRetryAttempts()))
                .onError(event -> log.error("Max retries reached after {} attempts: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage()));
        return retry;
    }

    /**
     * Decides whether a failure is worth another attempt.
     *
     * @param throwable failure raised by the RestTemplate
     * @return true for network failures, timeouts, 5xx and 429
     */
    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof ResourceAccessException) {
            return true;
        }
        if (throwable instanceof HttpServerErrorException) {
            return true;
        }
        if (throwable instanceof HttpClientErrorException) {
            return ((HttpClientErrorException) throwable).getStatusCode()
                    .value() == HttpStatus.TOO_MANY_REQUESTS.value();
        }
        return false;
    }
}
