package work.keymap.zmk2kanata.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;

/**
 * One definition per alias name, in first-registration order. Re-registering an identical
 * definition is a no-op; a different definition under a taken name gets a numeric suffix.
 */
public final class AliasRegistry {
    private final ErrorManager errors;
    private final Map<String, KanataFragment> fragments = new LinkedHashMap<>();
    private final Map<String, Integer> references = new LinkedHashMap<>();

    public AliasRegistry(ErrorManager errors) {
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    /**
     * Registers the fragment and counts one reference to it.
     *
     * @return the name to reference
     */
    public String reference(KanataFragment fragment) {
        String name = register(fragment);
        references.merge(name, 1, Integer::sum);
        return name;
    }

    /**
     * Registers without counting a reference (unreferenced macros).
     */
    public String register(KanataFragment fragment) {
        String name = fragment.name();
        int suffix = 2;
        while (true) {
            KanataFragment existing = fragments.get(name);
            if (existing == null) {
                fragments.put(name, fragment.name().equals(name) ? fragment : fragment.renamed(name));
                if (!name.equals(fragment.name())) {
                    errors.warning("transformer", ErrorKind.BINDING_RESOLUTION,
                        "Alias name " + fragment.name() + " already defined differently, using " + name,
                        Map.of("alias", fragment.name()));
                }
                return name;
            }
            if (sameDefinition(existing, fragment)) {
                return name;
            }
            name = fragment.name() + "_" + suffix++;
        }
    }

    public boolean contains(String name) {
        return fragments.containsKey(name);
    }

    public List<KanataFragment> fragments() {
        return new ArrayList<>(fragments.values());
    }

    public int referenceCount(String name) {
        return references.getOrDefault(name, 0);
    }

    private static boolean sameDefinition(KanataFragment a, KanataFragment b) {
        return a.definition().equals(b.definition()) && a.notes().equals(b.notes()) && a.script().equals(b.script());
    }
}
