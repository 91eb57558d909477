package com.tableadvisor.common.parser;

import com.tableadvisor.common.model.ActionKind;
import com.tableadvisor.common.model.FieldKey;
import com.tableadvisor.common.model.ResponseFields;
import com.tableadvisor.common.parser.ActionDetector.Detection;

import java.util.Optional;

/**
 * Reconciles the declared action with the recommendation inside the model's own rationale.
 *
 * <p>The rationale wins, with two fixed exceptions: a declared {@link ActionKind#FOLD} is
 * never changed, and waiting-like or skip results are left alone. An unrecognized action
 * only adopts a fold recommendation; any other recommendation gives it nothing to size or
 * confirm.
 */
public final class ContradictionResolver {

    private ContradictionResolver() {}

    public static Detection resolve(Detection declared,
                                    String rationale,
                                    String fullText,
                                    ResponseFields fields,
                                    FieldKey sizeKey) {
        ActionKind kind = declared.kind();

        if (kind == ActionKind.FOLD || kind.isWaitingLike() || kind == ActionKind.SKIP) {
            return declared;
        }
        if (rationale == null || rationale.isBlank()) {
            return declared;
        }

        Optional<ActionKind> recommended = RecommendationFinder.find(rationale)
            .or(() -> RecommendationFinder.find(fullText));

        if (recommended.isPresent()) {
            ActionKind rec = recommended.get();
            if (rec == ActionKind.FOLD) {
                return Detection.of(ActionKind.FOLD);
            }
            if (kind == ActionKind.UNRECOGNIZED) {
                return declared;
            }
            boolean declaredAggressive = kind == ActionKind.RAISE || kind == ActionKind.ALL_IN;
            boolean declaredPassive = kind == ActionKind.CALL || kind == ActionKind.CHECK;

            if (declaredAggressive && (rec == ActionKind.CALL || rec == ActionKind.CHECK)) {
                return Detection.of(rec);
            }
            if (declaredPassive && rec == ActionKind.ALL_IN) {
                return Detection.of(ActionKind.ALL_IN);
            }
            if (declaredPassive && rec == ActionKind.RAISE) {
                return new Detection(ActionKind.RAISE,
                    ActionDetector.raiseLabel("", fullText, fields, sizeKey));
            }
        }

        if (RecommendationFinder.recommendsFold(rationale) || RecommendationFinder.recommendsFold(fullText)) {
            return Detection.of(ActionKind.FOLD);
        }
        return declared;
    }
}
