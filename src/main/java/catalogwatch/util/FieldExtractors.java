package catalogwatch.util;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalises the raw text pulled out of catalogue markup.
 */
@Slf4j
public final class FieldExtractors {
    private static final Pattern PRICE_NOISE = Pattern.compile("[£$€Â,\\s\\u00A0]");
    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+");
    private static final Pattern AVAILABLE_COUNT = Pattern.compile("\\((\\d+)\\s+available\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Map<String, Integer> RATING_WORDS = Map.of(
            "One", 1,
            "Two", 2,
            "Three", 3,
            "Four", 4,
            "Five", 5
    );

    private FieldExtractors() {
    }

    /**
     * "£1,234.56" -> 1234.56. Anything that is not a number once currency symbols, commas and
     * whitespace are gone yields 0.00.
     */
    public static BigDecimal extractPrice(String priceText) {
        if (priceText == null || priceText.isBlank()) {
            return BigDecimal.ZERO.setScale(2);
        }
        String clean = PRICE_NOISE.matcher(priceText).replaceAll("");
        try {
            return new BigDecimal(clean).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException ex) {
            log.warn("Could not parse price: {}", priceText);
            return BigDecimal.ZERO.setScale(2);
        }
    }

    /**
     * "star-rating Three" -> 3, 0 when no ordinal word is present.
     */
    public static int extractRating(String ratingClass) {
        if (ratingClass == null) {
            return 0;
        }
        for (String token : WHITESPACE.split(ratingClass.trim())) {
            Integer value = RATING_WORDS.get(token);
            if (value != null) {
                return value;
            }
        }
        log.warn("Could not parse rating from: {}", ratingClass);
        return 0;
    }

    public static int extractNumber(String text) {
        if (text == null) {
            return 0;
        }
        Matcher matcher = FIRST_NUMBER.matcher(text);
        return matcher.find() ? parseCount(matcher.group()) : 0;
    }

    /**
     * "In stock (22 available)" -> 22; "In stock" without a count -> 1.
     */
    public static int extractAvailableCount(String availability) {
        if (availability == null || availability.isBlank()) {
            return 0;
        }
        Matcher matcher = AVAILABLE_COUNT.matcher(availability);
        if (matcher.find()) {
            return parseCount(matcher.group(1));
        }
        return availability.toLowerCase().contains("in stock") ? 1 : 0;
    }

    // digit runs longer than an int saturate at Integer.MAX_VALUE
    private static int parseCount(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            log.warn("Count out of range: {}", digits);
            return Integer.MAX_VALUE;
        }
    }

    public static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
