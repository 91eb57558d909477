package com.tableadvisor.common.parser;

import com.tableadvisor.common.model.FieldKey;
import com.tableadvisor.common.model.ResponseFields;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Explicit boundary search over labelled model output.
 *
 * <p>A label occurrence is one of the label's spellings (case-insensitive), not preceded
 * by a letter or digit, followed by optional blanks and an ASCII or full-width colon.
 * A value starts after the colon and stops at whichever comes first:
 * <ol>
 *   <li>the next label occurrence on the same line,</li>
 *   <li>the end of the line,</li>
 *   <li>the end of the text.</li>
 * </ol>
 * So {@code "A: 1 B: 2"} yields {@code A = "1"} even when the model forgets its newlines.
 *
 * <p>Stateless and thread-safe.
 */
public final class LabeledFieldScanner {

    private LabeledFieldScanner() {}

    /** A located label: {@code start} is the first label character, {@code valueStart} follows the colon. */
    public record Occurrence(FieldLabel label, int start, int valueStart) {}

    /**
     * Finds every label occurrence in order of position. At any one position the longest
     * matching spelling wins, which keeps {@code PREDICTED RAISE SIZE} from being read as
     * {@code RAISE SIZE}.
     */
    public static List<Occurrence> scan(String text) {
        List<Occurrence> found = new ArrayList<>();
        if (text == null || text.isEmpty()) return found;

        int i = 0;
        while (i < text.length()) {
            Occurrence hit = matchAt(text, i);
            if (hit != null) {
                found.add(hit);
                i = hit.valueStart();
            } else {
                i++;
            }
        }
        return found;
    }

    /** Value of the first occurrence of {@code label}, trimmed; {@code ""} when absent. */
    public static String extract(String text, FieldLabel label) {
        List<Occurrence> occurrences = scan(text);
        for (int k = 0; k < occurrences.size(); k++) {
            if (occurrences.get(k).label() == label) {
                return valueOf(text, occurrences, k);
            }
        }
        return "";
    }

    /** Values of every occurrence of {@code label}, in text order. Blank values are kept. */
    public static List<String> extractAll(String text, FieldLabel label) {
        List<Occurrence> occurrences = scan(text);
        List<String> values = new ArrayList<>();
        for (int k = 0; k < occurrences.size(); k++) {
            if (occurrences.get(k).label() == label) {
                values.add(valueOf(text, occurrences, k));
            }
        }
        return values;
    }

    /** First-occurrence value of every field-bearing label present in {@code text}. */
    public static ResponseFields extractFields(String text) {
        List<Occurrence> occurrences = scan(text);
        Map<FieldKey, String> values = new EnumMap<>(FieldKey.class);
        for (int k = 0; k < occurrences.size(); k++) {
            FieldKey key = occurrences.get(k).label().key();
            if (key != null && !values.containsKey(key)) {
                String value = valueOf(text, occurrences, k);
                if (!value.isEmpty()) values.put(key, value);
            }
        }
        return ResponseFields.of(values);
    }

    public static boolean contains(String text, FieldLabel label) {
        return scan(text).stream().anyMatch(o -> o.label() == label);
    }

    /** Replaces every label token (spelling and colon) with blanks, keeping all offsets. */
    public static String maskLabels(String text) {
        if (text == null || text.isEmpty()) return "";
        char[] chars = text.toCharArray();
        for (Occurrence o : scan(text)) {
            for (int p = o.start(); p < o.valueStart(); p++) {
                chars[p] = ' ';
            }
        }
        return new String(chars);
    }

    // ── boundary search ──────────────────────────────────────────────────────

    private static String valueOf(String text, List<Occurrence> occurrences, int index) {
        int from = occurrences.get(index).valueStart();
        int lineEnd = lineEnd(text, from);
        int end = lineEnd;
        if (index + 1 < occurrences.size()) {
            end = Math.min(end, occurrences.get(index + 1).start());
        }
        return end <= from ? "" : text.substring(from, end).trim();
    }

    private static int lineEnd(String text, int from) {
        for (int p = from; p < text.length(); p++) {
            char c = text.charAt(p);
            if (c == '\n' || c == '\r') return p;
        }
        return text.length();
    }

    private static Occurrence matchAt(String text, int i) {
        if (i > 0 && Character.isLetterOrDigit(text.charAt(i - 1))) return null;
        for (FieldLabel.Spelling spelling : FieldLabel.BY_LENGTH_DESC) {
            String s = spelling.text();
            if (!text.regionMatches(true, i, s, 0, s.length())) continue;
            int j = i + s.length();
            while (j < text.length() && (text.charAt(j) == ' ' || text.charAt(j) == '\t')) j++;
            if (j < text.length() && (text.charAt(j) == ':' || text.charAt(j) == '：')) {
                return new Occurrence(spelling.label(), i, j + 1);
            }
        }
        return null;
    }
}
