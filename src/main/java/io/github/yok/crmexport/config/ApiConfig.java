package io.github.yok.crmexport.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings of the remote CRM API, passed explicitly to the transport client.
 *
 * <pre>
 * crm:
 *   base-url: https://api.hubapi.com
 *   access-token: ${HUBSPOT_ACCESS_TOKEN:}
 *   page-size: 100
 *   timeout-seconds: 10
 *   retry:
 *     max-attempts: 5
 *     delay-seconds: 5
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "crm")
@Data
public class ApiConfig {

    // Scheme and host of the API, without trailing path
    private String baseUrl = "https://api.hubapi.com";

    // Private app / personal access token sent as a bearer token
    private String accessToken;

    // Records requested per object page
    private int pageSize = 100;

    // Connect and response timeout per HTTP attempt
    private int timeoutSeconds = 10;

    private Retry retry = new Retry();

    /**
     * Returns the access token, failing when it is not configured.
     *
     * @return access token
     * @throws IllegalStateException if the token is blank
     */
    public String requireAccessToken() {
        if (StringUtils.isBlank(accessToken)) {
            throw new IllegalStateException("crm.access-token is not configured. "
                    + "Please set HUBSPOT_ACCESS_TOKEN or 'crm.access-token' in application.yml.");
        }
        return accessToken;
    }

    /**
     * Retry policy applied uniformly to every transient transport failure.
     */
    @Data
    public static class Retry {
        // Total attempts per request, including the first one
        private int maxAttempts = 5;
        // Fixed delay between two attempts
        private long delaySeconds = 5;
    }
}
