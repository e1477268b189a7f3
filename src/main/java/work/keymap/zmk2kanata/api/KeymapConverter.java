package work.keymap.zmk2kanata.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.keymap.zmk2kanata.dts.DtsParser;
import work.keymap.zmk2kanata.dts.DtsRoot;
import work.keymap.zmk2kanata.error.ConversionError;
import work.keymap.zmk2kanata.error.ConversionException;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;
import work.keymap.zmk2kanata.error.Severity;
import work.keymap.zmk2kanata.extract.KeymapExtractor;
import work.keymap.zmk2kanata.model.KeymapConfig;
import work.keymap.zmk2kanata.model.Layer;
import work.keymap.zmk2kanata.output.KanataAssembler;

/**
 * Public entry point for converting a ZMK keymap into a Kanata configuration.
 *
 * <p>Every call gets its own {@link ErrorManager}; nothing is shared between conversions. A
 * {@link ConversionException} from any stage ends the run with {@link ConversionResult.Status#FAILURE}
 * and no output, the aborting error being recorded as critical.
 */
public final class KeymapConverter {
    private static final Logger LOG = LoggerFactory.getLogger(KeymapConverter.class);

    private final Function<ConversionConfiguration, Preprocessor> preprocessors;

    public KeymapConverter() {
        this(configuration -> new CppPreprocessor(configuration.preprocessorCommand()));
    }

    public KeymapConverter(Preprocessor preprocessor) {
        this(configuration -> preprocessor);
        Objects.requireNonNull(preprocessor, "preprocessor");
    }

    private KeymapConverter(Function<ConversionConfiguration, Preprocessor> preprocessors) {
        this.preprocessors = preprocessors;
    }

    /**
     * Reads (and preprocesses, when enabled) the configured input file and converts it.
     */
    public ConversionResult convert(ConversionConfiguration configuration) {
        Instant started = Instant.now();
        ErrorManager errors = new ErrorManager(configuration.raiseThreshold());
        String text;
        try {
            text = readInput(configuration);
        } catch (ConversionException ex) {
            return failed(ex, errors, started);
        }
        return run(text, configuration, errors, started);
    }

    /**
     * Converts keymap text that has already been preprocessed (or needs no preprocessing).
     * Only the modifier style and raise threshold of the configuration are used.
     */
    public ConversionResult convertText(String text, ConversionConfiguration configuration) {
        Objects.requireNonNull(text, "text");
        return run(text, configuration, new ErrorManager(configuration.raiseThreshold()), Instant.now());
    }

    private String readInput(ConversionConfiguration configuration) {
        if (configuration.preprocess()) {
            Preprocessor preprocessor = preprocessors.apply(configuration);
            return preprocessor.expand(configuration.input(), configuration.includeDirectories());
        }
        try {
            return Files.readString(configuration.input(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConversionException(ConversionError.of("input", Severity.CRITICAL, ErrorKind.INPUT_FAILURE,
                "Cannot read " + configuration.input() + ": " + ex.getMessage()), ex);
        }
    }

    private ConversionResult run(String text, ConversionConfiguration configuration, ErrorManager errors, Instant started) {
        try {
            DtsRoot root = new DtsParser(errors).parse(text);
            KeymapConfig config = new KeymapExtractor(errors).extract(root);
            String output = new KanataAssembler(configuration.modifierStyle()).assemble(config, errors);
            List<String> layerNames = config.layers().stream().map(Layer::name).collect(Collectors.toList());
            ConversionMetadata metadata = new ConversionMetadata(
                layerNames, config.behaviors().size(), config.globalSettings(), errors.toReport());
            LOG.info("Converted {} layers with {} diagnostics", layerNames.size(), errors.errors().size());
            return ConversionResult.success(output, metadata, started);
        } catch (ConversionException ex) {
            return failed(ex, errors, started);
        }
    }

    private static ConversionResult failed(ConversionException ex, ErrorManager errors, Instant started) {
        boolean recorded = errors.errors().stream().anyMatch(error -> error == ex.error());
        if (!recorded) {
            errors.record(ex.error().withSeverity(Severity.CRITICAL));
        }
        LOG.debug("Conversion aborted", ex);
        return ConversionResult.failure(ConversionMetadata.failed(errors.toReport()), started);
    }
}
