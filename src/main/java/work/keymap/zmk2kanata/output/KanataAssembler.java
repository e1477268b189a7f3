package work.keymap.zmk2kanata.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.keymap.zmk2kanata.error.ConversionError;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;
import work.keymap.zmk2kanata.error.ErrorReport;
import work.keymap.zmk2kanata.error.Severity;
import work.keymap.zmk2kanata.keys.ModifierStyle;
import work.keymap.zmk2kanata.model.Behavior;
import work.keymap.zmk2kanata.model.Binding;
import work.keymap.zmk2kanata.model.Combo;
import work.keymap.zmk2kanata.model.ConditionalLayer;
import work.keymap.zmk2kanata.model.GlobalSettings;
import work.keymap.zmk2kanata.model.KeymapConfig;
import work.keymap.zmk2kanata.model.Layer;
import work.keymap.zmk2kanata.model.Macro;
import work.keymap.zmk2kanata.transform.AliasRegistry;
import work.keymap.zmk2kanata.transform.BindingRenderer;
import work.keymap.zmk2kanata.transform.KanataFragment;
import work.keymap.zmk2kanata.transform.TransformContext;

/**
 * Produces the Kanata configuration text.
 *
 * <p>Sections, in order: header, {@code defcfg} (only when there are chords), global
 * {@code defvar}s, one {@code defalias} block, macro replay scripts, chords, conditional-layer notes,
 * one {@code deflayer} per layer in source order, and the summary of every diagnostic of the run. Everything is rendered before the text is written so the
 * summary also covers transform-time warnings. Identical input gives byte-identical output.
 */
public final class KanataAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(KanataAssembler.class);
    private static final String INDENT = "  ";

    private final ModifierStyle style;

    public KanataAssembler(ModifierStyle style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    public String assemble(KeymapConfig config, ErrorManager errors) {
        TransformContext context = new TransformContext(config, style, errors);
        AliasRegistry aliases = new AliasRegistry(errors);
        BindingRenderer renderer = new BindingRenderer(context, aliases);

        List<List<String>> layerBlocks = new ArrayList<>();
        for (Layer layer : config.layers()) {
            layerBlocks.add(layerBlock(layer, renderer));
        }
        List<String> chords = new ArrayList<>();
        for (Combo combo : config.combos()) {
            renderer.combos().transform(combo).ifPresent(chords::add);
        }
        for (Behavior behavior : config.behaviors().values()) {
            if (behavior instanceof Macro macro) {
                renderer.registerUnreferenced(macro);
            }
        }
        List<String> conditional = conditionalNotes(config, errors);

        StringBuilder out = new StringBuilder();
        header(out);
        if (!chords.isEmpty()) {
            chordConfig(out);
        }
        globals(out, config.globalSettings());
        aliasBlock(out, aliases);
        macroScripts(out, aliases);
        chordBlock(out, chords);
        if (!conditional.isEmpty()) {
            conditional.forEach(line -> out.append(line).append('\n'));
            out.append('\n');
        }
        for (List<String> block : layerBlocks) {
            block.forEach(line -> out.append(line).append('\n'));
            out.append('\n');
        }
        summary(out, config, aliases, errors);
        LOG.debug("Assembled {} layers and {} aliases", config.layers().size(), aliases.fragments().size());
        return out.toString();
    }

    private void header(StringBuilder out) {
        out.append(";; ZMK to Kanata Configuration\n");
        out.append(";; Generated automatically - DO NOT EDIT\n");
        out.append(";; Modifier convention: ").append(style == ModifierStyle.MAC ? "Mac (lcmd/lopt)" : "PC (lmet/lalt)").append('\n');
        out.append(";; No defsrc: add one matching your keyboard before loading this file\n");
        out.append('\n');
    }

    /**
     * Kanata only accepts {@code defchordsv2-experimental} with {@code concurrent-tap-hold} enabled.
     */
    private static void chordConfig(StringBuilder out) {
        out.append("(defcfg\n");
        out.append(INDENT).append("concurrent-tap-hold yes\n");
        out.append(")\n\n");
    }

    private static void globals(StringBuilder out, GlobalSettings settings) {
        out.append(";; Global settings\n");
        out.append("(defvar\n");
        out.append(INDENT).append("tap-time ").append(settings.tapTimeMs()).append('\n');
        out.append(INDENT).append("hold-time ").append(settings.holdTimeMs()).append('\n');
        out.append(")\n\n");
    }

    private static void aliasBlock(StringBuilder out, AliasRegistry aliases) {
        List<KanataFragment> fragments = aliases.fragments();
        if (fragments.isEmpty()) {
            return;
        }
        out.append("(defalias\n");
        for (KanataFragment fragment : fragments) {
            for (String note : fragment.notes()) {
                out.append(INDENT).append(note).append('\n');
            }
            out.append(INDENT).append(fragment.name()).append(' ').append(fragment.definition()).append('\n');
        }
        out.append(")\n\n");
    }

    /**
     * Replay scripts are kept verbatim in block comments; the alias above carries the action.
     */
    private static void macroScripts(StringBuilder out, AliasRegistry aliases) {
        List<KanataFragment> macros = aliases.fragments().stream()
            .filter(KanataFragment::isMacro)
            .sorted((a, b) -> Boolean.compare(aliases.referenceCount(b.name()) > 0, aliases.referenceCount(a.name()) > 0))
            .collect(Collectors.toList());
        for (KanataFragment macro : macros) {
            out.append("#| defmacro ").append(macro.name()).append('\n');
            for (String line : macro.script()) {
                out.append(INDENT).append(line.replace("|#", "| #")).append('\n');
            }
            out.append("|#\n\n");
        }
    }

    private static void chordBlock(StringBuilder out, List<String> chords) {
        if (chords.isEmpty()) {
            return;
        }
        out.append("(defchordsv2-experimental\n");
        for (String chord : chords) {
            out.append(INDENT).append(chord).append('\n');
        }
        out.append(")\n\n");
    }

    private static List<String> conditionalNotes(KeymapConfig config, ErrorManager errors) {
        List<String> lines = new ArrayList<>();
        for (ConditionalLayer layer : config.conditionalLayers()) {
            String ifLayers = layer.ifLayers().stream()
                .map(index -> layerName(config, index))
                .collect(Collectors.joining(" + "));
            lines.add(";; TODO: conditional layer " + layer.name() + ": " + ifLayers + " -> "
                + layerName(config, layer.thenLayer()) + " has no Kanata equivalent");
            errors.warning("assembler", ErrorKind.UNSUPPORTED_FEATURE,
                "Conditional layer " + layer.name() + " not translated", Map.of("line", layer.line()));
        }
        return lines;
    }

    private static String layerName(KeymapConfig config, int index) {
        Optional<Layer> layer = config.layer(index);
        return layer.map(Layer::name).orElse(String.valueOf(index));
    }

    private static List<String> layerBlock(Layer layer, BindingRenderer renderer) {
        List<String> lines = new ArrayList<>();
        lines.add("(deflayer " + layer.name());
        String owner = "layer " + layer.name();
        for (List<Binding> row : layer.rows()) {
            List<String> keys = new ArrayList<>();
            for (Binding binding : row) {
                keys.add(renderer.render(binding, owner));
            }
            lines.add(INDENT + String.join(" ", keys));
        }
        lines.add(")");
        return lines;
    }

    private static void summary(StringBuilder out, KeymapConfig config, AliasRegistry aliases, ErrorManager errors) {
        ErrorReport report = errors.toReport();
        out.append(";; Conversion summary\n");
        out.append(";; layers: ").append(config.layers().size())
            .append(", aliases: ").append(aliases.fragments().size())
            .append(", behaviors: ").append(config.behaviors().size()).append('\n');
        out.append(";; diagnostics: ")
            .append(report.count(Severity.CRITICAL)).append(" critical, ")
            .append(report.count(Severity.ERROR)).append(" error, ")
            .append(report.count(Severity.WARNING)).append(" warning, ")
            .append(report.count(Severity.INFO)).append(" info, ")
            .append(report.count(Severity.DEBUG)).append(" debug\n");
        for (ConversionError error : errors.errors()) {
            out.append(";; ").append(error.describe().replace('\n', ' ')).append('\n');
        }
    }
}
