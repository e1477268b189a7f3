package work.keymap.zmk2kanata.dts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node property. The value is a {@link String}, an {@link Integer}, a {@code List} of
 * {@code Integer}/{@code String} cells, or {@link Boolean#TRUE}, depending on {@link #kind()}.
 *
 * @param name property name
 * @param value parsed value
 * @param kind value shape
 * @param line line of the property name
 * @param cellLines source line of each array cell, empty for non-array values
 */
public record DtsProperty(String name, Object value, PropertyKind kind, int line, List<Integer> cellLines) {
    public DtsProperty {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(kind, "kind");
        if (value instanceof List<?> list) {
            value = Collections.unmodifiableList(new ArrayList<>(list));
        }
        cellLines = cellLines == null ? List.of() : List.copyOf(cellLines);
    }

    public static DtsProperty flag(String name, int line) {
        return new DtsProperty(name, Boolean.TRUE, PropertyKind.BOOLEAN, line, List.of());
    }

    /**
     * Text of a string or reference value, or the first string cell of a string list.
     */
    public Optional<String> stringValue() {
        if (value instanceof String text) {
            return Optional.of(text);
        }
        if (kind == PropertyKind.STRING_LIST && !cells().isEmpty()) {
            return Optional.of(String.valueOf(cells().get(0)));
        }
        return Optional.empty();
    }

    /**
     * Integer of a bare number or of a single-cell array such as {@code <300>}.
     */
    public Optional<Integer> integerValue() {
        if (value instanceof Integer number) {
            return Optional.of(number);
        }
        List<Object> cells = cells();
        if (kind == PropertyKind.ARRAY && cells.size() == 1 && cells.get(0) instanceof Integer number) {
            return Optional.of(number);
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public List<Object> cells() {
        if (value instanceof List<?>) {
            return (List<Object>) value;
        }
        return List.of();
    }

    /**
     * Cells rendered as strings, integers in decimal.
     */
    public List<String> cellTexts() {
        List<String> texts = new ArrayList<>();
        for (Object cell : cells()) {
            texts.add(String.valueOf(cell));
        }
        return texts;
    }

    /**
     * Line of the cell at {@code index}, falling back to the property line.
     */
    public int cellLine(int index) {
        return index >= 0 && index < cellLines.size() ? cellLines.get(index) : line;
    }

    public boolean isTrue() {
        return kind == PropertyKind.BOOLEAN;
    }
}
