package work.keymap.zmk2kanata.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects diagnostics for a single conversion run.
 *
 * <p>One instance is created per conversion and handed to every stage. A report at or above the
 * raise threshold is recorded and then thrown as a {@link ConversionException}.
 */
public final class ErrorManager {
    private static final Logger LOG = LoggerFactory.getLogger(ErrorManager.class);

    private final Severity raiseThreshold;
    private final List<ConversionError> errors = new ArrayList<>();

    public ErrorManager() {
        this(Severity.ERROR);
    }

    public ErrorManager(Severity raiseThreshold) {
        this.raiseThreshold = Objects.requireNonNull(raiseThreshold, "raiseThreshold");
    }

    public Severity raiseThreshold() {
        return raiseThreshold;
    }

    /**
     * Records the error and throws when its severity reaches the threshold.
     */
    public ConversionError report(ConversionError error) {
        record(error);
        if (error.severity().isAtLeast(raiseThreshold)) {
            throw new ConversionException(error);
        }
        return error;
    }

    /**
     * Records the error without ever raising (used for failures that are already propagating).
     */
    public ConversionError record(ConversionError error) {
        Objects.requireNonNull(error, "error");
        errors.add(error);
        log(error);
        return error;
    }

    public ConversionError debug(String source, ErrorKind kind, String message) {
        return report(ConversionError.of(source, Severity.DEBUG, kind, message));
    }

    public ConversionError warning(String source, ErrorKind kind, String message, Map<String, Object> context) {
        return report(new ConversionError(message, source, Severity.WARNING, kind, null, null, context));
    }

    public List<ConversionError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ConversionError> errorsFrom(String source) {
        List<ConversionError> matching = new ArrayList<>();
        for (ConversionError error : errors) {
            if (error.source().equals(source)) {
                matching.add(error);
            }
        }
        return matching;
    }

    public boolean hasErrorsAtLeast(Severity severity) {
        for (ConversionError error : errors) {
            if (error.severity().isAtLeast(severity)) {
                return true;
            }
        }
        return false;
    }

    public ErrorReport toReport() {
        return ErrorReport.of(errors);
    }

    private static void log(ConversionError error) {
        String line = error.describe();
        switch (error.severity()) {
            case DEBUG:
                LOG.debug(line);
                break;
            case INFO:
                LOG.info(line);
                break;
            case WARNING:
                LOG.warn(line);
                break;
            default:
                LOG.error(line);
                break;
        }
    }
}
