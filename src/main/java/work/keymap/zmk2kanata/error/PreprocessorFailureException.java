package work.keymap.zmk2kanata.error;

/**
 * Raised when the external C preprocessor cannot be run or exits with a failure.
 */
public final class PreprocessorFailureException extends ConversionException {
    public PreprocessorFailureException(String message, Throwable cause) {
        super(ConversionError.of("preprocessor", Severity.CRITICAL, ErrorKind.PREPROCESSOR_FAILURE, message), cause);
    }
}
