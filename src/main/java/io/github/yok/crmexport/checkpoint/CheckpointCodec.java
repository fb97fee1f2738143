package io.github.yok.crmexport.checkpoint;

import io.github.yok.crmexport.model.Phase;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Text format of checkpoint files.
 *
 * <pre>
 * crm-export-checkpoint v1
 * resource=contacts
 * phase=DATA
 * value=12345
 * sha256=&lt;hex digest of the four lines above joined by \n&gt;
 * </pre>
 *
 * <p>
 * Every field is validated on decode; any mismatch is reported as
 * {@link CorruptCheckpointException} so the caller can fall back to a fresh start.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class CheckpointCodec {

    static final String HEADER = "crm-export-checkpoint v1";

    private static final Pattern INDEX = Pattern.compile("\\d{1,9}");

    private CheckpointCodec() {
        // Utility class; do not instantiate.
    }

    /**
     * Renders a checkpoint.
     *
     * @param key phase key
     * @param value cursor or index
     * @return file content, newline terminated
     * @throws IllegalArgumentException if the value is not valid for the phase
     */
    static String encode(CheckpointKey key, String value) {
        String problem = validateValue(key, value);
        if (problem != null) {
            throw new IllegalArgumentException("Invalid checkpoint for " + key + ": " + problem);
        }
        String body = body(key, value);
        return body + "\nsha256=" + DigestUtils.sha256Hex(body) + "\n";
    }

    /**
     * Parses and verifies a checkpoint.
     *
     * @param key phase key the file belongs to
     * @param content file content
     * @return saved cursor or index
     * @throws CorruptCheckpointException if any part of the content is invalid
     */
    static String decode(CheckpointKey key, String content) throws CorruptCheckpointException {
        List<String> lines = content.lines().map(String::strip).filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
        if (lines.size() != 5) {
            throw new CorruptCheckpointException("expected 5 lines but found " + lines.size());
        }
        if (!HEADER.equals(lines.get(0))) {
            throw new CorruptCheckpointException("unsupported header '" + lines.get(0) + "'");
        }
        String resource = field(lines.get(1), "resource");
        String phase = field(lines.get(2), "phase");
        String value = field(lines.get(3), "value");
        String checksum = field(lines.get(4), "sha256");

        if (!key.getResourceType().getApiName().equals(resource)
                || !key.getPhase().name().equals(phase)) {
            throw new CorruptCheckpointException(
                    "belongs to " + resource + "/" + phase + ", not " + key);
        }
        if (!DigestUtils.sha256Hex(body(key, value)).equals(checksum)) {
            throw new CorruptCheckpointException("checksum mismatch");
        }
        String problem = validateValue(key, value);
        if (problem != null) {
            throw new CorruptCheckpointException(problem);
        }
        return value;
    }

    private static String body(CheckpointKey key, String value) {
        return HEADER + "\nresource=" + key.getResourceType().getApiName() + "\nphase="
                + key.getPhase().name() + "\nvalue=" + value;
    }

    private static String field(String line, String name) throws CorruptCheckpointException {
        String prefix = name + "=";
        if (!line.startsWith(prefix)) {
            throw new CorruptCheckpointException("missing field '" + name + "'");
        }
        return line.substring(prefix.length());
    }

    private static String validateValue(CheckpointKey key, String value) {
        if (StringUtils.isBlank(value)) {
            return "value is blank";
        }
        if (StringUtils.containsAny(value, '\r', '\n') || !value.equals(value.strip())) {
            return "value must be single-line text without surrounding whitespace";
        }
        if (key.getPhase() == Phase.ASSOCIATIONS && !INDEX.matcher(value).matches()) {
            return "association index must be a non-negative integer but was '" + value + "'";
        }
        return null;
    }

    /**
     * Raised when a checkpoint file cannot be trusted.
     */
    static class CorruptCheckpointException extends Exception {

        private static final long serialVersionUID = 1L;

        CorruptCheckpointException(String message) {
            super(message);
        }
    }
}
