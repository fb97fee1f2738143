package io.github.yok.crmexport;

import io.github.yok.crmexport.config.IngestionConfig;
import io.github.yok.crmexport.core.ExportPipeline;
import io.github.yok.crmexport.core.RunOptions;
import io.github.yok.crmexport.core.RunSummary;
import io.github.yok.crmexport.model.ResourceType;
import io.github.yok.crmexport.util.ErrorHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --fresh} or {@code -f} discards saved checkpoints and completion markers first.</li>
 * <li>{@code --limit N} or {@code -n N} stops every phase after {@code N} records (data) or
 * {@code N} source objects (associations).</li>
 * <li>{@code --sample} or {@code -s} is {@code --limit} with {@code ingestion.sample-limit}.</li>
 * <li>{@code --types a,b} or {@code -t a,b} restricts the run to the given resource types.</li>
 * <li>{@code --no-export} skips the CSV snapshot.</li>
 * </ul>
 *
 * <p>
 * Running again without {@code --fresh} resumes every unfinished phase from its checkpoint.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final ExportPipeline pipeline;
    private final IngestionConfig ingestionConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Parses arguments and runs {@link ExportPipeline}.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        boolean fresh = false;
        boolean export = true;
        Integer limit = null;
        List<ResourceType> types = new ArrayList<>();
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--fresh":
                    case "-f":
                        fresh = true;
                        break;
                    case "--limit":
                    case "-n":
                        limit = parseLimit(i + 1 < args.length ? args[++i] : null);
                        break;
                    case "--sample":
                    case "-s":
                        limit = ingestionConfig.getSampleLimit();
                        break;
                    case "--types":
                    case "-t":
                        if (i + 1 < args.length) {
                            types = Arrays.stream(args[++i].split(","))
                                    .filter(StringUtils::isNotBlank).map(ResourceType::fromName)
                                    .collect(Collectors.toList());
                        }
                        break;
                    case "--no-export":
                        export = false;
                        break;
                    default:
                        log.warn("Unknown argument: {}", args[i]);
                }
            }
        } catch (IllegalArgumentException e) {
            ErrorHandler.errorAndExit("Invalid argument: " + e.getMessage());
            return;
        }

        RunOptions options = RunOptions.builder().fresh(fresh).limit(limit).resourceTypes(types)
                .export(export).build();
        log.info("Options: {}", options);

        try {
            RunSummary summary = pipeline.run(options);
            log.info("Export finished. Fully complete: {}", summary.isFullyComplete());
        } catch (Exception e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    private static Integer parseLimit(String value) {
        if (value == null) {
            throw new IllegalArgumentException("--limit requires a number");
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number but was '" + value + "'", e);
        }
    }
}
