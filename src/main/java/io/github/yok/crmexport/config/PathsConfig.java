package io.github.yok.crmexport.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code data-path} property from the application root
 * configuration and composes the working directories of an export run.
 *
 * <p>
 * The {@code data-path} is the base directory under which this tool keeps resume state
 * ({@code /state}) and writes the CSV snapshot ({@code /export}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base path that serves as the application's root data directory
    private String dataPath;

    /**
     * Returns the directory holding checkpoint and completion-marker files.
     *
     * @return the path to the state directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public String getState() {
        return resolve("state");
    }

    /**
     * Returns the directory receiving the CSV snapshot.
     *
     * @return the path to the export directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public String getExport() {
        return resolve("export");
    }

    private String resolve(String child) {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return dataPath.endsWith("/") ? dataPath + child : dataPath + "/" + child;
    }
}
