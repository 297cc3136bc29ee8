package io.github.cyfko.dnfql.core.utils;

/**
 * Text helpers shared by the tokenizer, the parser and their error messages.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TextUtils {

    /**
     * Default half-width of the context window shown in error messages.
     */
    public static final int DEFAULT_WINDOW = 40;

    private TextUtils() {}

    /**
     * Extracts the text surrounding a position, flattened to a single line.
     * <p>
     * The window spans {@code [position - window, position + window)}, clamped to the text.
     * Line breaks and tabs are replaced by spaces so the snippet can be embedded in a one-line message.
     * </p>
     *
     * <pre>{@code
     * TextUtils.near("A AND\nB", 2, 40);  // "A AND B"
     * TextUtils.near("0123456789", 5, 2); // "3456"
     * }</pre>
     *
     * @param text     the full text, {@code null} is treated as empty
     * @param position zero-based offset of interest, clamped to the text
     * @param window   number of characters kept on each side
     * @return the flattened snippet
     */
    public static String near(String text, int position, int window) {
        if (text == null || text.isEmpty()) return "";
        if (window < 0) {
            throw new IllegalArgumentException("window must not be negative, got: " + window);
        }
        int pos = Math.max(0, Math.min(position, text.length()));
        int start = Math.max(0, pos - window);
        int end = Math.min(text.length(), pos + window);
        return text.substring(start, end)
                .replace('\n', ' ')
                .replace('\r', ' ')
                .replace('\t', ' ');
    }

    /**
     * Same as {@link #near(String, int, int)} with {@link #DEFAULT_WINDOW}.
     */
    public static String near(String text, int position) {
        return near(text, position, DEFAULT_WINDOW);
    }

    /**
     * Characters that may appear inside an identifier, and therefore delimit keyword operators.
     *
     * @param c the character
     * @return {@code true} for letters, digits and underscore
     */
    public static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Characters accepted in a literal identifier: ASCII letters, digits and underscore.
     *
     * @param c the character
     * @return {@code true} if {@code c} matches {@code [A-Za-z0-9_]}
     */
    public static boolean isAsciiIdentifierChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }
}
