package work.keymap.zmk2kanata.error;

/**
 * Categories of conversion failures, used as the error code of a {@link ConversionError}.
 */
public enum ErrorKind {
    INPUT_FAILURE("input_failure"),
    PREPROCESSOR_FAILURE("preprocessor_failure"),
    PARSE_ERROR("parse_error"),
    EXTRACTION_ERROR("extraction_error"),
    MALFORMED_MACRO("malformed_macro"),
    BINDING_RESOLUTION("binding_resolution"),
    TIMING_VALIDATION("timing_validation"),
    UNSUPPORTED_FEATURE("unsupported_feature");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
