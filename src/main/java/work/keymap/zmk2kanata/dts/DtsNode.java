package work.keymap.zmk2kanata.dts;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A devicetree node. Children are owned by their parent; {@link #parent()} is a back-reference only.
 * Mutation is limited to the parser (package-private).
 */
public class DtsNode {
    private final String name;
    private final int line;
    private final Set<String> labels = new LinkedHashSet<>();
    private final Map<String, DtsNode> children = new LinkedHashMap<>();
    private final Map<String, DtsProperty> properties = new LinkedHashMap<>();
    private DtsNode parent;

    public DtsNode(String name, int line) {
        this.name = Objects.requireNonNull(name, "name");
        this.line = line;
    }

    public String name() {
        return name;
    }

    public int line() {
        return line;
    }

    public Set<String> labels() {
        return Collections.unmodifiableSet(labels);
    }

    /**
     * First label, which ZMK uses as the behavior name.
     */
    public Optional<String> label() {
        return labels.stream().findFirst();
    }

    public Collection<DtsNode> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    public Optional<DtsNode> child(String childName) {
        return Optional.ofNullable(children.get(childName));
    }

    public Map<String, DtsProperty> properties() {
        return Collections.unmodifiableMap(properties);
    }

    public Optional<DtsProperty> property(String propertyName) {
        return Optional.ofNullable(properties.get(propertyName));
    }

    public Optional<String> stringProperty(String propertyName) {
        return property(propertyName).flatMap(DtsProperty::stringValue);
    }

    public Optional<Integer> integerProperty(String propertyName) {
        return property(propertyName).flatMap(DtsProperty::integerValue);
    }

    public boolean hasFlag(String propertyName) {
        return property(propertyName).map(DtsProperty::isTrue).orElse(false);
    }

    public Optional<DtsNode> parent() {
        return Optional.ofNullable(parent);
    }

    public String path() {
        if (parent == null) {
            return "/";
        }
        String parentPath = parent.path();
        return parentPath.endsWith("/") ? parentPath + name : parentPath + "/" + name;
    }

    /**
     * This node and all of its descendants in pre-order.
     */
    public List<DtsNode> descendants() {
        List<DtsNode> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(DtsNode node, List<DtsNode> out) {
        out.add(node);
        for (DtsNode child : node.children.values()) {
            collect(child, out);
        }
    }

    void addLabel(String label) {
        labels.add(label);
    }

    void addChild(DtsNode child) {
        child.parent = this;
        children.put(child.name(), child);
    }

    DtsProperty putProperty(DtsProperty property) {
        return properties.put(property.name(), property);
    }

    @Override
    public String toString() {
        return "DtsNode(" + path() + ")";
    }
}
