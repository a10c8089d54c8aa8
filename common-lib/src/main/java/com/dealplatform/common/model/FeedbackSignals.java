package com.dealplatform.common.model;

import java.time.Year;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight reading of free-text client feedback: an explicit price figure, agreement
 * or pushback. Used wherever no structured counter-proposal was supplied.
 */
public final class FeedbackSignals {

    /** Figures below this are read as durations or percentages, not prices. */
    static final double MIN_PRICE_FIGURE = 1000.0;

    /** Oldest year a bare four-digit figure is read as a model year rather than a price. */
    static final int FIRST_MODEL_YEAR = 1950;

    private static final Pattern AMOUNT =
        Pattern.compile("(\\d{1,3}(?:[ ,.]\\d{3})+|\\d+)(?:[.,](\\d{1,2}))?\\s*([kK])?(?![\\d])");

    private static final List<String> AGREEMENT = List.of(
        "accept", "agree", "deal", "sounds good", "looks good", "ok", "okay", "fine", "let's do it", "sign");

    private static final List<String> NEGATION = List.of(
        "not ", "no deal", "don't", "do not", "won't", "cannot", "can't", "never", "refuse");

    private static final List<String> PUSHBACK = List.of(
        "too expensive", "too high", "too much", "expensive", "cheaper", "lower", "reduce",
        "discount", "over my budget", "out of budget", "can't afford");

    private FeedbackSignals() {}

    /** First figure in the text that reads as a price, e.g. "28 500", "28,500", "28.5k". */
    public static Optional<Double> extractPrice(String feedback) {
        if (feedback == null || feedback.isBlank()) {
            return Optional.empty();
        }
        Matcher m = AMOUNT.matcher(feedback);
        while (m.find()) {
            if (isModelYear(m)) {
                continue;
            }
            double value = Double.parseDouble(m.group(1).replaceAll("[ ,.]", ""));
            if (m.group(2) != null) {
                value += Double.parseDouble(m.group(2)) / Math.pow(10, m.group(2).length());
            }
            if (m.group(3) != null) {
                value *= 1000;
            }
            if (value >= MIN_PRICE_FIGURE) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /** "the 2021 model": four digits with no separator, decimals or k suffix, within the model-year range. */
    private static boolean isModelYear(Matcher m) {
        if (m.group(2) != null || m.group(3) != null || !m.group(1).matches("\\d{4}")) {
            return false;
        }
        int year = Integer.parseInt(m.group(1));
        return year >= FIRST_MODEL_YEAR && year <= Year.now(ZoneOffset.UTC).getValue() + 1;
    }

    public static boolean isAgreement(String feedback) {
        String text = normalise(feedback);
        return !text.isEmpty() && containsWord(text, AGREEMENT) && NEGATION.stream().noneMatch(text::contains);
    }

    public static boolean isPushback(String feedback) {
        String text = normalise(feedback);
        return !text.isEmpty() && (PUSHBACK.stream().anyMatch(text::contains) || NEGATION.stream().anyMatch(text::contains));
    }

    private static boolean containsWord(String text, List<String> words) {
        for (String word : words) {
            if (Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static String normalise(String feedback) {
        return feedback == null ? "" : feedback.toLowerCase(Locale.ROOT).trim();
    }
}
