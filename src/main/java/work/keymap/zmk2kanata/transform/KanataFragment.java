package work.keymap.zmk2kanata.transform;

import java.util.List;
import java.util.Objects;

/**
 * A named definition destined for the {@code defalias} block.
 *
 * @param name stable alias name, referenced as {@code @name}
 * @param definition Kanata action text
 * @param notes {@code ;; TODO:} lines for source properties Kanata cannot express
 * @param script macro replay script ({@code press lsft}, {@code tap a}, ...), empty for other behaviors
 */
public record KanataFragment(String name, String definition, List<String> notes, List<String> script) {
    public KanataFragment {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(definition, "definition");
        notes = List.copyOf(notes);
        script = List.copyOf(script);
    }

    public static KanataFragment alias(String name, String definition, List<String> notes) {
        return new KanataFragment(name, definition, notes, List.of());
    }

    public boolean isMacro() {
        return !script.isEmpty();
    }

    KanataFragment renamed(String newName) {
        return new KanataFragment(newName, definition, notes, script);
    }
}
