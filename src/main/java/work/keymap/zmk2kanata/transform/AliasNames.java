package work.keymap.zmk2kanata.transform;

import java.util.List;
import java.util.Locale;
import work.keymap.zmk2kanata.keys.KeyParam;

/**
 * Deterministic alias naming: the same behavior with the same parameters always yields the same
 * name, which is what collapses repeated uses into one definition.
 */
public final class AliasNames {
    private AliasNames() {}

    /**
     * {@code aliasName("&mt", [LSHIFT, A])} is {@code mt_lshift_a};
     * {@code LC(LS(LALT))} contributes {@code lc_ls_lalt}.
     */
    public static String aliasName(String behaviorName, List<KeyParam> params) {
        StringBuilder sb = new StringBuilder(behaviorName.startsWith("&") ? behaviorName.substring(1) : behaviorName);
        for (KeyParam param : params) {
            sb.append('_').append(param.raw());
        }
        return sanitize(sb.toString());
    }

    static String sanitize(String text) {
        String cleaned = text.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9_-]", "_")
            .replaceAll("_+", "_")
            .replaceAll("^_|_$", "");
        return cleaned.isEmpty() ? "alias" : cleaned;
    }
}
