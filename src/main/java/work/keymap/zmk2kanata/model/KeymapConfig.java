package work.keymap.zmk2kanata.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the transform pass needs, extracted from the devicetree.
 *
 * @param behaviors declared behaviors by name, in declaration order
 */
public record KeymapConfig(
    List<Layer> layers,
    Map<String, Behavior> behaviors,
    GlobalSettings globalSettings,
    List<Combo> combos,
    List<ConditionalLayer> conditionalLayers
) {
    public KeymapConfig {
        layers = List.copyOf(layers);
        behaviors = Collections.unmodifiableMap(new LinkedHashMap<>(behaviors));
        Objects.requireNonNull(globalSettings, "globalSettings");
        combos = List.copyOf(combos);
        conditionalLayers = List.copyOf(conditionalLayers);
    }

    public Optional<Layer> layer(int index) {
        for (Layer layer : layers) {
            if (layer.index() == index) {
                return Optional.of(layer);
            }
        }
        return Optional.empty();
    }

    public Optional<Behavior> behavior(String name) {
        String bare = name.startsWith("&") ? name.substring(1) : name;
        return Optional.ofNullable(behaviors.get(bare));
    }
}
