package io.github.yok.crmexport.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds settings of the local relational store.
 *
 * <ul>
 * <li>{@code store.url}: JDBC URL of the SQLite database file</li>
 * <li>{@code store.deduplicate-associations}: when true, a unique index on the association
 * 4-tuple makes re-inserted edges no-ops; when false, reruns may store duplicate edges</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "store")
@Getter
@Setter
@NoArgsConstructor
public class StoreConfig {

    /**
     * JDBC URL of the store.
     */
    private String url;

    /**
     * Whether association edges are deduplicated.
     */
    private boolean deduplicateAssociations = true;
}
