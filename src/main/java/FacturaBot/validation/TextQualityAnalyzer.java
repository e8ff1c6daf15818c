package FacturaBot.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calidad del texto OCR (0-10).
 *
 * OCR text quality on a 0-10 scale, from the presence of dates, amounts and
 * identifier keywords plus digit and amount density.
 */
@Component
public class TextQualityAnalyzer {

    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern AMOUNT = Pattern.compile("\\d+[.,]\\d{2}");
    private static final Pattern DATE = Pattern.compile("\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4}");
    private static final Pattern IDENTIFIER_KEYWORD = Pattern.compile("(?i)RNC|NCF|NIT|ID");

    public double score(String text) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        int lines = text.split("\n", -1).length;
        int amounts = count(AMOUNT, text);

        double digitDensity = (double) count(DIGIT, text) / text.length();
        double amountDensity = (double) amounts / Math.max(1, lines);

        double points = (DATE.matcher(text).find() ? 1.0 : 0.0)
                + (amounts > 0 ? 1.0 : 0.0)
                + (IDENTIFIER_KEYWORD.matcher(text).find() ? 1.0 : 0.0)
                + Math.min(digitDensity * 10, 2.0)
                + Math.min(amountDensity * 20, 2.0);
        return points / 7.0 * 10.0;
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }
}
