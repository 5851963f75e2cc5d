package fr.lapetina.confkit.domain.merge;

import java.util.Locale;

/**
 * Key comparison policy shared by the merger and the field resolver.
 *
 * Keys are relaxed before comparison: lower-cased, with {@code _} and {@code -} removed, so that
 * {@code API_KEY}, {@code api-key} and {@code apiKey} all name the same entry.
 */
public final class Keys {

    /**
     * Reserved root-level key holding the document version.
     */
    public static final String VERSION = "version";

    private Keys() {
        // Utility class
    }

    public static String normalize(String key) {
        if (key == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c != '_' && c != '-') {
                sb.append(c);
            }
        }
        return sb.toString().trim().toLowerCase(Locale.ROOT);
    }

    public static boolean matches(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    public static boolean isVersionKey(String key) {
        return VERSION.equals(normalize(key));
    }
}
