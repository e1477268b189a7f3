package work.keymap.zmk2kanata.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.keymap.zmk2kanata.error.ConversionError;
import work.keymap.zmk2kanata.error.ErrorReport;
import work.keymap.zmk2kanata.model.GlobalSettings;

/**
 * Facts about a conversion that accompany the generated text.
 *
 * @param layerNames layers in output order; empty when the conversion failed before extraction
 * @param behaviorCount declared behaviors found in the keymap
 * @param globalSettings timing defaults in effect, {@code null} when extraction did not happen
 * @param errors every diagnostic of the run
 */
public record ConversionMetadata(
    List<String> layerNames,
    int behaviorCount,
    GlobalSettings globalSettings,
    ErrorReport errors
) {
    public ConversionMetadata {
        layerNames = List.copyOf(Objects.requireNonNull(layerNames, "layerNames"));
        Objects.requireNonNull(errors, "errors");
    }

    public static ConversionMetadata failed(ErrorReport errors) {
        return new ConversionMetadata(List.of(), 0, null, errors);
    }

    public int layerCount() {
        return layerNames.size();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("layers", layerNames);
        map.put("layerCount", layerCount());
        map.put("behaviorCount", behaviorCount);
        if (globalSettings != null) {
            Map<String, Object> timings = new LinkedHashMap<>();
            timings.put("tapTimeMs", globalSettings.tapTimeMs());
            timings.put("holdTimeMs", globalSettings.holdTimeMs());
            map.put("globalSettings", timings);
        }
        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("total", errors.total());
        diagnostics.put("bySeverity", errors.countsBySeverity());
        Map<String, Object> bySource = new LinkedHashMap<>();
        errors.bySource().forEach((source, list) -> {
            List<Map<String, Object>> entries = new ArrayList<>();
            list.forEach(error -> entries.add(toMap(error)));
            bySource.put(source, entries);
        });
        diagnostics.put("bySource", bySource);
        map.put("diagnostics", diagnostics);
        return map;
    }

    private static Map<String, Object> toMap(ConversionError error) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("severity", error.severity().name().toLowerCase());
        map.put("kind", error.kind().code());
        map.put("message", error.message());
        if (error.line() != null) {
            map.put("line", error.line());
        }
        if (error.column() != null) {
            map.put("column", error.column());
        }
        if (!error.context().isEmpty()) {
            Map<String, Object> context = new LinkedHashMap<>();
            error.context().forEach((key, value) -> context.put(key, String.valueOf(value)));
            map.put("context", context);
        }
        return map;
    }
}
