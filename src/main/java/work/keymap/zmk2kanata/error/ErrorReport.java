package work.keymap.zmk2kanata.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the diagnostics of a run: counts by severity and entries grouped by source.
 */
public record ErrorReport(
    int total,
    Map<String, Integer> countsBySeverity,
    Map<String, List<ConversionError>> bySource
) {
    public ErrorReport {
        countsBySeverity = Collections.unmodifiableMap(new LinkedHashMap<>(countsBySeverity));
        bySource = Collections.unmodifiableMap(new LinkedHashMap<>(bySource));
    }

    public static ErrorReport of(List<ConversionError> errors) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            counts.put(severity.name().toLowerCase(), 0);
        }
        Map<String, List<ConversionError>> grouped = new LinkedHashMap<>();
        for (ConversionError error : errors) {
            counts.merge(error.severity().name().toLowerCase(), 1, Integer::sum);
            grouped.computeIfAbsent(error.source(), key -> new ArrayList<>()).add(error);
        }
        Map<String, List<ConversionError>> frozen = new LinkedHashMap<>();
        grouped.forEach((source, list) -> frozen.put(source, List.copyOf(list)));
        return new ErrorReport(errors.size(), counts, frozen);
    }

    public int count(Severity severity) {
        return countsBySeverity.getOrDefault(severity.name().toLowerCase(), 0);
    }
}
