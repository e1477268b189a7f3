package work.keymap.zmk2kanata.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a {@link KeymapConverter} run (usable by the CLI and embedding apps).
 *
 * @param output generated Kanata text, empty when the conversion failed
 */
public record ConversionResult(
    Status status,
    String output,
    ConversionMetadata metadata,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public ConversionResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(metadata, "metadata");
    }

    public static ConversionResult success(String output, ConversionMetadata metadata, Instant startedAt) {
        return new ConversionResult(Status.SUCCESS, output, metadata, startedAt, Instant.now());
    }

    public static ConversionResult failure(ConversionMetadata metadata, Instant startedAt) {
        return new ConversionResult(Status.FAILURE, "", metadata, startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("metadata", metadata.toSerializableMap());
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getOriginalMessage() + "\"}";
        }
    }

    public String toYaml() {
        try {
            return YAML.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "status: error\nmessage: \"" + ex.getOriginalMessage() + "\"\n";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
