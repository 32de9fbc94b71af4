package com.purchasingpower.graphrag.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tokenisation shared by keyword extraction, keyword scoring and hashing embeddings.
 */
public final class TextUtils {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    public static final Set<String> STOPWORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "by", "can", "for", "from", "has", "have",
        "how", "in", "into", "is", "it", "its", "of", "on", "or", "that", "the", "their", "this",
        "to", "use", "used", "using", "via", "was", "what", "when", "which", "will", "with", "you",
        "your", "node", "nodes", "allows", "lets", "also", "other", "more", "any", "all");

    private TextUtils() {
    }

    /**
     * Lower-cased alphanumeric tokens, stopwords and single characters removed, in text order.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String raw : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (raw.length() > 1 && !STOPWORDS.contains(raw)) {
                tokens.add(raw);
            }
        }
        return tokens;
    }

    public static boolean containsWord(String text, String word) {
        return tokenize(text).contains(word.toLowerCase(Locale.ROOT));
    }

    /**
     * Truncate large strings for logging.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    public static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
