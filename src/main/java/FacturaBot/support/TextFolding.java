package FacturaBot.support;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Accent- and case-folding for OCR text.
 *
 * {@link #fold(String)} keeps the string length unchanged, so offsets found in the folded
 * copy can be used to cut the original text.
 */
public final class TextFolding {

    private static final Map<String, Pattern> WORD_PATTERNS = new ConcurrentHashMap<>();

    private TextFolding() {
    }

    /**
     * Lower-cases and strips diacritics character by character ("Vehículo" → "vehiculo").
     */
    public static String fold(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 128) {
                sb.append(Character.toLowerCase(c));
                continue;
            }
            String decomposed = Normalizer.normalize(String.valueOf(c), Normalizer.Form.NFD);
            sb.append(Character.toLowerCase(decomposed.charAt(0)));
        }
        return sb.toString();
    }

    /**
     * Whole-word keyword test on already folded text. Keywords may contain punctuation
     * ("rd$", "r.n.c").
     */
    public static boolean containsWord(String foldedText, String keyword) {
        return WORD_PATTERNS.computeIfAbsent(fold(keyword), TextFolding::wordPattern)
                .matcher(foldedText)
                .find();
    }

    public static int countWords(String foldedText, Collection<String> keywords) {
        int hits = 0;
        for (String keyword : keywords) {
            if (containsWord(foldedText, keyword)) {
                hits++;
            }
        }
        return hits;
    }

    /**
     * Substring test for any of the keyword fragments inside
     * {@code [position - radius, position + radius)} of the original text.
     */
    public static boolean anyFragmentNear(String text, int position, int radius, Collection<String> fragments) {
        if (text == null || text.isEmpty() || position < 0) {
            return false;
        }
        int start = Math.max(0, position - radius);
        int end = Math.min(text.length(), position + radius);
        String window = fold(text.substring(start, end));
        for (String fragment : fragments) {
            if (window.contains(fold(fragment))) {
                return true;
            }
        }
        return false;
    }

    // boundaries only where the keyword itself starts/ends with a letter or digit ("rd$200")
    private static Pattern wordPattern(String foldedKeyword) {
        StringBuilder regex = new StringBuilder();
        if (Character.isLetterOrDigit(foldedKeyword.charAt(0))) {
            regex.append("(?<![\\p{L}\\p{N}])");
        }
        regex.append(Pattern.quote(foldedKeyword));
        if (Character.isLetterOrDigit(foldedKeyword.charAt(foldedKeyword.length() - 1))) {
            regex.append("(?![\\p{L}\\p{N}])");
        }
        return Pattern.compile(regex.toString());
    }
}
