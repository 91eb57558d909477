package com.tableadvisor.common.parser;

import com.tableadvisor.common.model.ActionKind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the action the model's own reasoning recommends.
 *
 * <p>Pattern families are tried in a fixed order: explicit recommendation verbs per action
 * (all-in, raise, call, check, fold), then conclusion phrases. The first family that
 * matches anywhere in the text decides.
 */
public final class RecommendationFinder {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String VERB =
        "(?:\\bSHOULD\\b|\\bRECOMMEND(?:S|ED)?\\b|\\bSUGGEST(?:S|ED)?\\b|\\bMUST\\b"
        + "|\\bBEST\\s+(?:MOVE|PLAY|OPTION)\\s+IS\\b|建议|应当|应该|应|选择|最优)";

    private static final String FILLER = "\\s*(?:(?:TO|GO|A|AN|JUST|SIMPLY)\\s+)*";

    private static final Map<ActionKind, Pattern> RECOMMENDATIONS = new LinkedHashMap<>();

    static {
        RECOMMENDATIONS.put(ActionKind.ALL_IN, recommend("ALL[- ]?IN\\b|SHOVE\\b|全压|全下"));
        RECOMMENDATIONS.put(ActionKind.RAISE,  recommend("RAIS(?:E|ING)\\b|BET(?:TING)?\\b|加注|下注"));
        RECOMMENDATIONS.put(ActionKind.CALL,   recommend("CALL(?:ING)?\\b|跟注"));
        RECOMMENDATIONS.put(ActionKind.CHECK,  recommend("CHECK(?:ING)?\\b|过牌|让牌"));
        RECOMMENDATIONS.put(ActionKind.FOLD,   recommend("FOLD(?:ING)?\\b|弃牌"));
    }

    private static final Pattern CONCLUSION = Pattern.compile(
        "(?:\\bCONCLUSION\\b|\\bFINAL(?:LY)?\\b|\\bOVERALL\\b|结论|最终|综上)[^\\n]{0,12}?"
            + "(\\bALL[- ]?IN\\b|\\bRAISE\\b|\\bBET\\b|\\bCALL\\b|\\bCHECK\\b|\\bFOLD\\b|全压|加注|跟注|过牌|弃牌)",
        FLAGS);

    /** Conclusive fold language that overrides a non-fold headline even without a verb match. */
    private static final Pattern FOLD_PHRASE = Pattern.compile(
        "最终(?:选择)?弃牌|结论[:：]?\\s*弃牌|综上[^\\n]{0,12}弃牌|应该?弃牌|选择弃牌|建议弃牌"
            + "|必须弃牌|果断弃牌|直接弃牌|只能(?:选择)?弃牌"
            + "|\\bFOLD(?:ING)?\\s+IS\\s+(?:THE\\s+)?(?:ONLY|BEST|RIGHT|CORRECT)\\b"
            + "|\\b(?:JUST|HAVE\\s+TO|MUST)\\s+FOLD\\b|\\bFOLD\\s+HERE\\b",
        FLAGS);

    private RecommendationFinder() {}

    public static Optional<ActionKind> find(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        for (Map.Entry<ActionKind, Pattern> entry : RECOMMENDATIONS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return Optional.of(entry.getKey());
            }
        }

        Matcher conclusion = CONCLUSION.matcher(text);
        if (conclusion.find()) {
            return Optional.ofNullable(kindOf(conclusion.group(1)));
        }
        return Optional.empty();
    }

    public static boolean recommendsFold(String text) {
        return text != null && FOLD_PHRASE.matcher(text).find();
    }

    private static Pattern recommend(String target) {
        return Pattern.compile(VERB + FILLER + "(?:" + target + ")", FLAGS);
    }

    private static ActionKind kindOf(String token) {
        String t = token.toUpperCase().replace(" ", "-");
        if (t.startsWith("ALL") || t.equals("全压")) return ActionKind.ALL_IN;
        if (t.equals("RAISE") || t.equals("BET") || t.equals("加注")) return ActionKind.RAISE;
        if (t.equals("CALL") || t.equals("跟注")) return ActionKind.CALL;
        if (t.equals("CHECK") || t.equals("过牌")) return ActionKind.CHECK;
        if (t.equals("FOLD") || t.equals("弃牌")) return ActionKind.FOLD;
        return null;
    }
}
