package work.keymap.zmk2kanata.dts;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root node {@code /} with the label index.
 *
 * <p>The index maps each label to a stable node id (the node's pre-order position) and is built
 * once by {@link #seal(String)}; it is read-only afterwards.
 */
public final class DtsRoot extends DtsNode {
    public static final String NAME = "/";

    private List<DtsNode> nodes = List.of();
    private Map<String, Integer> labelIndex;

    public DtsRoot() {
        super(NAME, 1);
    }

    /**
     * Builds the label index. Two distinct nodes sharing a label are rejected.
     */
    void seal(String source) {
        if (labelIndex != null) {
            throw new IllegalStateException("Label index already built");
        }
        List<DtsNode> ordered = descendants();
        Map<String, Integer> index = new HashMap<>();
        for (int id = 0; id < ordered.size(); id++) {
            DtsNode node = ordered.get(id);
            for (String label : node.labels()) {
                Integer previous = index.putIfAbsent(label, id);
                if (previous != null && previous != id) {
                    DtsNode first = ordered.get(previous);
                    throw DtsParseException.at(source,
                        "Duplicate label '" + label + "' on " + node.path() + " (already used by " + first.path() + ")",
                        node.line(), 1);
                }
            }
        }
        this.nodes = List.copyOf(ordered);
        this.labelIndex = Collections.unmodifiableMap(index);
    }

    public Map<String, Integer> labelIndex() {
        return labelIndex == null ? Map.of() : labelIndex;
    }

    public DtsNode node(int id) {
        return nodes.get(id);
    }

    public Optional<DtsNode> findByLabel(String label) {
        Integer id = labelIndex().get(label);
        return id == null ? Optional.empty() : Optional.of(nodes.get(id));
    }

    /**
     * Resolves {@code &label} or {@code &{/path/to/node}}; the leading ampersand is optional.
     */
    public Optional<DtsNode> resolveReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String target = reference.startsWith("&") ? reference.substring(1) : reference;
        if (target.startsWith("{") && target.endsWith("}")) {
            return findNode(target.substring(1, target.length() - 1));
        }
        return findByLabel(target);
    }

    /**
     * Looks up a node by absolute path, e.g. {@code /keymap/default_layer}.
     */
    public Optional<DtsNode> findNode(String path) {
        if (path == null || !path.startsWith("/")) {
            return Optional.empty();
        }
        DtsNode current = this;
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            Optional<DtsNode> next = current.child(segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }
}
