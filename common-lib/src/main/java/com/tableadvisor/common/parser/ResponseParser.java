package com.tableadvisor.common.parser;

import com.tableadvisor.common.model.ActionKind;
import com.tableadvisor.common.model.ClassifiedResponse;
import com.tableadvisor.common.model.ConsistencyVerdict;
import com.tableadvisor.common.model.FieldKey;
import com.tableadvisor.common.model.ResponseFields;
import com.tableadvisor.common.parser.ActionDetector.Detection;

import java.util.Optional;

/**
 * Classifies one model response, complete or partial, into a {@link ClassifiedResponse}.
 *
 * <p>Action candidates are tried in order: every {@code ACTION} value, then the first
 * line, then the whole text with label tokens masked. The first recognised candidate
 * decides; the rationale may then overrule it through {@link ContradictionResolver}.
 *
 * <p>Total: never throws. Blank input is {@link ActionKind#WAITING}; anything unexpected
 * degrades to {@link ActionKind#UNRECOGNIZED} with no fields.
 */
public final class ResponseParser {

    private ResponseParser() {}

    public static ClassifiedResponse parse(String text) {
        if (text == null || text.isBlank()) {
            return new ClassifiedResponse(ActionKind.WAITING, ActionDetector.WAITING_LABEL,
                ResponseFields.empty(), ConsistencyVerdict.medium());
        }
        try {
            return classify(text);
        } catch (RuntimeException e) {
            return new ClassifiedResponse(ActionKind.UNRECOGNIZED, "",
                ResponseFields.empty(), ConsistencyVerdict.low("unparseable response"));
        }
    }

    /** True once an {@code ACTION} label carrying a recognised keyword has arrived. */
    public static boolean declaresAction(String text) {
        if (text == null || text.isBlank()) return false;
        ResponseFields fields = LabeledFieldScanner.extractFields(text);
        for (String value : LabeledFieldScanner.extractAll(text, FieldLabel.ACTION)) {
            ActionKind kind = ActionDetector.detect(value, text, fields, FieldKey.RAISE_SIZE).kind();
            if (kind != ActionKind.UNRECOGNIZED) return true;
        }
        return false;
    }

    /** True once the rationale label has arrived, even with an empty value so far. */
    public static boolean rationaleStarted(String text) {
        return text != null && LabeledFieldScanner.contains(text, FieldLabel.RATIONALE);
    }

    // ── classification ───────────────────────────────────────────────────────

    private static ClassifiedResponse classify(String text) {
        boolean labelled = !LabeledFieldScanner.scan(text).isEmpty();
        ResponseFields fields = labelled
            ? LabeledFieldScanner.extractFields(text)
            : ResponseFields.empty().with(FieldKey.RATIONALE, text.trim());

        String rationale = fields.get(FieldKey.RATIONALE);
        ConsistencyVerdict verdict = ConsistencyValidator.validate(
            fields.get(FieldKey.HAND), fields.get(FieldKey.BOARD), rationale);

        Detection detection = detectAction(text, fields);
        if (detection.kind() == ActionKind.WAITING || detection.kind() == ActionKind.READY) {
            detection = predictedTurn(detection, text, fields);
        } else {
            detection = ContradictionResolver.resolve(detection, rationale, text, fields, FieldKey.RAISE_SIZE);
        }
        return new ClassifiedResponse(detection.kind(), detection.display(), fields, verdict);
    }

    private static Detection detectAction(String text, ResponseFields fields) {
        for (String value : LabeledFieldScanner.extractAll(text, FieldLabel.ACTION)) {
            Detection d = ActionDetector.detect(value, text, fields, FieldKey.RAISE_SIZE);
            if (d.kind() != ActionKind.UNRECOGNIZED) return d;
        }

        String masked = LabeledFieldScanner.maskLabels(text);
        Detection firstLine = ActionDetector.detect(firstLine(masked), text, fields, FieldKey.RAISE_SIZE);
        if (firstLine.kind() != ActionKind.UNRECOGNIZED) return firstLine;

        Detection whole = ActionDetector.detect(masked, text, fields, FieldKey.RAISE_SIZE);
        if (whole.kind() != ActionKind.UNRECOGNIZED) return whole;

        // echo the declared action if there was one, otherwise the start of the text
        String declared = LabeledFieldScanner.extract(text, FieldLabel.ACTION);
        return ActionDetector.unrecognized(declared.isEmpty() ? masked : declared);
    }

    /**
     * A waiting response whose {@code PREDICTED} field names a concrete action becomes READY
     * with a predicted label. A bare READY keyword looks for an advisory phrase instead.
     */
    private static Detection predictedTurn(Detection detection, String text, ResponseFields fields) {
        String predicted = fields.get(FieldKey.PREDICTED_ACTION);
        if (!predicted.isEmpty()) {
            Detection p = ActionDetector.detect(predicted, "", fields, FieldKey.PREDICTED_RAISE_SIZE);
            if (p.kind().isConcreteAction()) {
                return new Detection(ActionKind.READY, ActionDetector.PREDICTED_PREFIX + p.display());
            }
        }
        if (detection.kind() == ActionKind.READY) {
            Optional<ActionKind> hint = RecommendationFinder.find(LabeledFieldScanner.maskLabels(text));
            if (hint.isPresent()) {
                String display = hint.get() == ActionKind.RAISE
                    ? ActionDetector.raiseLabel("", "", fields, FieldKey.PREDICTED_RAISE_SIZE)
                    : ActionDetector.labelFor(hint.get());
                return new Detection(ActionKind.READY, ActionDetector.PREDICTED_PREFIX + display);
            }
        }
        return detection;
    }

    private static String firstLine(String text) {
        String trimmed = text.strip();
        int nl = trimmed.indexOf('\n');
        return nl < 0 ? trimmed : trimmed.substring(0, nl);
    }
}
