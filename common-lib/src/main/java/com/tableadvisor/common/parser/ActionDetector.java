package com.tableadvisor.common.parser;

import com.tableadvisor.common.model.ActionKind;
import com.tableadvisor.common.model.FieldKey;
import com.tableadvisor.common.model.ResponseFields;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a raw action string onto an {@link ActionKind} and its display label.
 *
 * <p>Keywords are checked in precedence order: all-in, raise, call, check, fold, ready,
 * waiting, skip. English keywords match whole words only, so {@code "BETTER"} is not a bet;
 * Chinese keywords match as substrings.
 */
public final class ActionDetector {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern ALL_IN  = Pattern.compile("\\bALL[- ]?IN\\b|\\bSHOVE\\b|全压|全下", FLAGS);
    private static final Pattern RAISE   = Pattern.compile("\\b(?:RAISE[SD]?|RAISING|BETS?|BETTING)\\b|加注|下注", FLAGS);
    private static final Pattern CALL    = Pattern.compile("\\bCALL(?:S|ING)?\\b|跟注", FLAGS);
    private static final Pattern CHECK   = Pattern.compile("\\bCHECK(?:S|ING)?\\b|过牌|让牌", FLAGS);
    private static final Pattern FOLD    = Pattern.compile("\\bFOLD(?:S|ING)?\\b|弃牌", FLAGS);
    private static final Pattern READY   = Pattern.compile("\\bREADY\\b|\\bPREPARE\\b|准备|就绪", FLAGS);
    private static final Pattern WAITING = Pattern.compile("\\bWAIT(?:ING)?\\b|\\bNOT\\s+YOUR\\s+TURN\\b|等待", FLAGS);
    private static final Pattern SKIP    = Pattern.compile("\\bSKIP\\b|跳过", FLAGS);

    /** A number directly after the raise keyword, e.g. {@code RAISE 120} or {@code bet to 300}. */
    private static final Pattern AMOUNT_AFTER_KEYWORD = Pattern.compile(
        "(?:\\bRAISE[SD]?\\b|\\bBETS?\\b|加注|下注)[ \\t]*(?:TO[ \\t]+|到[ \\t]*)?(\\d+(?:\\.\\d+)?)", FLAGS);

    private static final Pattern AFTER_EQUALS = Pattern.compile("=\\s*(\\d+(?:\\.\\d+)?)");

    /** Standalone numbers only; the halves of {@code 2/3} are pot fractions, not chip counts. */
    private static final Pattern STANDALONE_NUMBER = Pattern.compile("(?<![\\d./])(\\d+(?:\\.\\d+)?)(?![\\d./])");

    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    public static final String ALL_IN_LABEL   = "All-in";
    public static final String RAISE_LABEL    = "Raise";
    public static final String CALL_LABEL     = "Call";
    public static final String CHECK_LABEL    = "Check";
    public static final String FOLD_LABEL     = "Fold";
    public static final String WAITING_LABEL  = "Not your turn";
    public static final String READY_LABEL    = "Get ready";
    public static final String PREDICTED_PREFIX = "Predicted: ";

    /** Unrecognized action text is echoed back truncated to this many characters. */
    public static final int UNRECOGNIZED_ECHO_LENGTH = 20;

    private ActionDetector() {}

    /** Kind plus display label for one candidate action string. */
    public record Detection(ActionKind kind, String display) {

        public static Detection of(ActionKind kind) {
            return new Detection(kind, labelFor(kind));
        }
    }

    /**
     * @param raw       the candidate action text (an ACTION value, a first line, or the masked body)
     * @param fullText  the complete response, searched for raise amounts the candidate lacks
     * @param fields    already extracted fields; supplies the raise-size field and the pot
     * @param sizeKey   which field sizes a raise: {@link FieldKey#RAISE_SIZE} or {@link FieldKey#PREDICTED_RAISE_SIZE}
     */
    public static Detection detect(String raw, String fullText, ResponseFields fields, FieldKey sizeKey) {
        String candidate = raw == null ? "" : raw.trim();
        if (candidate.isEmpty()) return new Detection(ActionKind.UNRECOGNIZED, "");

        if (ALL_IN.matcher(candidate).find()) return Detection.of(ActionKind.ALL_IN);
        if (RAISE.matcher(candidate).find()) {
            return new Detection(ActionKind.RAISE, raiseLabel(candidate, fullText, fields, sizeKey));
        }
        if (CALL.matcher(candidate).find())    return Detection.of(ActionKind.CALL);
        if (CHECK.matcher(candidate).find())   return Detection.of(ActionKind.CHECK);
        if (FOLD.matcher(candidate).find())    return Detection.of(ActionKind.FOLD);
        if (READY.matcher(candidate).find())   return Detection.of(ActionKind.READY);
        if (WAITING.matcher(candidate).find()) return Detection.of(ActionKind.WAITING);
        if (SKIP.matcher(candidate).find())    return Detection.of(ActionKind.SKIP);

        return new Detection(ActionKind.UNRECOGNIZED, echo(candidate));
    }

    /**
     * Raise label with the best available size, in priority order:
     * <ol>
     *   <li>the raise-size field (number after {@code =}, else its last standalone number)</li>
     *   <li>a number right after the keyword, in the candidate and then in the full text</li>
     *   <li>two thirds of the pot, rounded</li>
     * </ol>
     * Falls back to the bare label when none applies.
     */
    public static String raiseLabel(String candidate, String fullText, ResponseFields fields, FieldKey sizeKey) {
        String amount = sizeFromField(fields.get(sizeKey));
        if (amount == null) amount = firstGroup(AMOUNT_AFTER_KEYWORD, candidate);
        if (amount == null) amount = firstGroup(AMOUNT_AFTER_KEYWORD, fullText);
        if (amount == null) amount = twoThirdsOfPot(fields.get(FieldKey.POT));
        return amount == null ? RAISE_LABEL : RAISE_LABEL + " " + amount;
    }

    public static String labelFor(ActionKind kind) {
        return switch (kind) {
            case ALL_IN -> ALL_IN_LABEL;
            case RAISE -> RAISE_LABEL;
            case CALL -> CALL_LABEL;
            case CHECK -> CHECK_LABEL;
            case FOLD -> FOLD_LABEL;
            case READY -> READY_LABEL;
            case WAITING -> WAITING_LABEL;
            case SKIP, UNRECOGNIZED -> "";
        };
    }

    // ── sizing helpers ───────────────────────────────────────────────────────

    static String sizeFromField(String value) {
        if (value == null || value.isBlank()) return null;
        String afterEquals = firstGroup(AFTER_EQUALS, value);
        if (afterEquals != null) return normalize(afterEquals);

        Matcher m = STANDALONE_NUMBER.matcher(value);
        String last = null;
        while (m.find()) last = m.group(1);
        return last == null ? null : normalize(last);
    }

    private static String twoThirdsOfPot(String potValue) {
        String pot = firstGroup(FIRST_NUMBER, potValue);
        if (pot == null) return null;
        double size = Double.parseDouble(pot) * 2.0 / 3.0;
        long rounded = Math.round(size);
        return rounded > 0 ? Long.toString(rounded) : null;
    }

    private static String firstGroup(Pattern pattern, String text) {
        if (text == null || text.isEmpty()) return null;
        Matcher m = pattern.matcher(text);
        return m.find() ? normalize(m.group(1)) : null;
    }

    /** {@code "120.0"} reads as {@code "120"}; other decimals are kept as written. */
    private static String normalize(String number) {
        if (number == null) return null;
        if (number.contains(".")) {
            String stripped = number.replaceAll("0+$", "");
            return stripped.endsWith(".") ? stripped.substring(0, stripped.length() - 1) : stripped;
        }
        return number;
    }

    /** Unrecognized detection echoing the start of {@code candidate}. */
    public static Detection unrecognized(String candidate) {
        return new Detection(ActionKind.UNRECOGNIZED, echo(candidate == null ? "" : candidate.strip()));
    }

    private static String echo(String candidate) {
        if (candidate.length() <= UNRECOGNIZED_ECHO_LENGTH) return candidate;
        return candidate.substring(0, UNRECOGNIZED_ECHO_LENGTH) + "...";
    }
}
