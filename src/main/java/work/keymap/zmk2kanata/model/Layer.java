package work.keymap.zmk2kanata.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A keymap layer in source order.
 */
public record Layer(String name, int index, List<Binding> bindings) {
    public Layer {
        Objects.requireNonNull(name, "name");
        bindings = List.copyOf(bindings);
    }

    /**
     * Bindings grouped into rows by source line, which is how keymaps lay out the physical keyboard.
     */
    public List<List<Binding>> rows() {
        List<List<Binding>> rows = new ArrayList<>();
        List<Binding> current = new ArrayList<>();
        int currentLine = Integer.MIN_VALUE;
        for (Binding binding : bindings) {
            if (!current.isEmpty() && binding.line() != currentLine) {
                rows.add(List.copyOf(current));
                current.clear();
            }
            current.add(binding);
            currentLine = binding.line();
        }
        if (!current.isEmpty()) {
            rows.add(List.copyOf(current));
        }
        return rows;
    }
}
