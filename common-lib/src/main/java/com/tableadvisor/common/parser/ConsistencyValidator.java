package com.tableadvisor.common.parser;

import com.tableadvisor.common.model.ConsistencyVerdict;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Advisory cross-check of the hand strength the rationale claims against the cards the
 * model says it saw. Never changes the classified action; only attaches a verdict.
 *
 * <p>Checks, first failure wins:
 * <ol>
 *   <li>top pair of X: X must be in the hand and on the board</li>
 *   <li>pair of X: X must be in the hand or on the board</li>
 *   <li>two pair: at least two ranks appear twice</li>
 *   <li>three of a kind / trips / set: some rank appears three times</li>
 *   <li>straight: at least five distinct ranks</li>
 *   <li>no card appears in both the hand and the board</li>
 *   <li>the hand is either unreadable (0 cards) or exactly 2 cards</li>
 * </ol>
 */
public final class ConsistencyValidator {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String RANK =
        "(10|ACE|KING|QUEEN|JACK|TEN|NINE|EIGHT|SEVEN|SIX|FIVE|FOUR|THREE|TWO|DEUCE|[AKQJT2-9])(?:E?S)?\\b";

    private static final Pattern TOP_PAIR_EN = Pattern.compile("\\bTOP\\s+PAIR\\s*(?:OF\\s+|,\\s*)?" + RANK, FLAGS);
    private static final Pattern TOP_PAIR_ZH = Pattern.compile("顶对\\s*(10|[AKQJT2-9])", FLAGS);
    private static final Pattern PAIR_EN     = Pattern.compile("\\bPAIR\\s+OF\\s+" + RANK, FLAGS);
    private static final Pattern PAIR_ZH     = Pattern.compile("(?<![顶两])对\\s*(10|[AKQJT2-9])", FLAGS);
    private static final Pattern TWO_PAIR    = Pattern.compile("\\bTWO\\s+PAIRS?\\b|两对|兩對", FLAGS);
    private static final Pattern TRIPS       = Pattern.compile("\\bTHREE\\s+OF\\s+A\\s+KIND\\b|\\bTRIPS\\b|\\bSET\\s+OF\\b|三条|三條", FLAGS);
    private static final Pattern STRAIGHT    = Pattern.compile("\\bSTRAIGHT\\b(?!\\s+DRAW)|顺子(?!听)|順子(?!聽)", FLAGS);

    private static final Pattern CARD = Pattern.compile("(10|[AKQJT2-9])\\s*([SHDC♠♥♦♣♤♡♢♧])?", FLAGS);

    /** Two suited cards written without a separator, e.g. {@code AhKd}. */
    private static final Pattern JOINED_PAIR = Pattern.compile(
        "(10|[AKQJT2-9])([SHDC♠♥♦♣♤♡♢♧])(10|[AKQJT2-9])([SHDC♠♥♦♣♤♡♢♧])", FLAGS);

    private static final Map<String, String> RANK_WORDS = Map.ofEntries(
        Map.entry("ACE", "A"), Map.entry("KING", "K"), Map.entry("QUEEN", "Q"), Map.entry("JACK", "J"),
        Map.entry("TEN", "T"), Map.entry("10", "T"), Map.entry("NINE", "9"), Map.entry("EIGHT", "8"),
        Map.entry("SEVEN", "7"), Map.entry("SIX", "6"), Map.entry("FIVE", "5"), Map.entry("FOUR", "4"),
        Map.entry("THREE", "3"), Map.entry("TWO", "2"), Map.entry("DEUCE", "2"));

    private ConsistencyValidator() {}

    /** A card as read from the text; {@code suit} is {@code '?'} when the model omitted it. */
    record Card(String rank, char suit) {}

    public static ConsistencyVerdict validate(String hand, String board, String rationale) {
        if (rationale == null || rationale.isBlank()) {
            return ConsistencyVerdict.medium();
        }

        List<Card> handCards = parseCards(hand);
        List<Card> boardCards = parseCards(board);
        Set<String> handRanks = ranks(handCards);
        Set<String> boardRanks = ranks(boardCards);
        Map<String, Integer> counts = rankCounts(handCards, boardCards);

        String topPair = claimedRank(rationale, TOP_PAIR_EN, TOP_PAIR_ZH);
        if (topPair != null) {
            if (!handRanks.contains(topPair) || !boardRanks.contains(topPair)) {
                return ConsistencyVerdict.low("claims top pair of " + topPair + " but hand/board do not pair it");
            }
        } else {
            String pair = claimedRank(rationale, PAIR_EN, PAIR_ZH);
            if (pair != null && !handRanks.contains(pair) && !boardRanks.contains(pair)) {
                return ConsistencyVerdict.low("claims a pair of " + pair + " but no such rank is visible");
            }
        }

        if (TWO_PAIR.matcher(rationale).find()) {
            long paired = counts.values().stream().filter(c -> c >= 2).count();
            if (paired < 2) {
                return ConsistencyVerdict.low("claims two pair but fewer than two ranks are paired");
            }
        }

        if (TRIPS.matcher(rationale).find() && counts.values().stream().noneMatch(c -> c >= 3)) {
            return ConsistencyVerdict.low("claims three of a kind but no rank appears three times");
        }

        if (STRAIGHT.matcher(rationale).find() && counts.size() < 5) {
            return ConsistencyVerdict.low("claims a straight but fewer than five distinct ranks are visible");
        }

        for (Card card : handCards) {
            if (card.suit() != '?' && boardCards.contains(card)) {
                return ConsistencyVerdict.low("card " + card.rank() + card.suit() + " appears in both hand and board");
            }
        }

        if (!handCards.isEmpty() && handCards.size() != 2) {
            return ConsistencyVerdict.low("hand has " + handCards.size() + " cards, expected 2");
        }

        return ConsistencyVerdict.high();
    }

    // ── card reading ─────────────────────────────────────────────────────────

    static List<Card> parseCards(String text) {
        List<Card> cards = new ArrayList<>();
        if (text == null || text.isBlank()) return cards;

        for (String token : text.split("[\\s,，、/|\\[\\]()]+")) {
            if (token.isEmpty()) continue;
            Matcher m = CARD.matcher(token);
            if (m.matches()) {
                cards.add(new Card(canonicalRank(m.group(1)), canonicalSuit(m.group(2))));
            } else {
                Matcher pair = JOINED_PAIR.matcher(token);
                if (pair.matches()) {
                    cards.add(new Card(canonicalRank(pair.group(1)), canonicalSuit(pair.group(2))));
                    cards.add(new Card(canonicalRank(pair.group(3)), canonicalSuit(pair.group(4))));
                }
            }
        }
        return cards;
    }

    private static String claimedRank(String rationale, Pattern english, Pattern chinese) {
        Matcher m = english.matcher(rationale);
        if (m.find()) return canonicalRank(m.group(1));
        m = chinese.matcher(rationale);
        if (m.find()) return canonicalRank(m.group(1));
        return null;
    }

    private static String canonicalRank(String raw) {
        String upper = raw.toUpperCase();
        return RANK_WORDS.getOrDefault(upper, upper);
    }

    private static char canonicalSuit(String raw) {
        if (raw == null || raw.isEmpty()) return '?';
        return switch (raw.toLowerCase().charAt(0)) {
            case 's', '♠', '♤' -> 's';
            case 'h', '♥', '♡' -> 'h';
            case 'd', '♦', '♢' -> 'd';
            case 'c', '♣', '♧' -> 'c';
            default -> '?';
        };
    }

    private static Set<String> ranks(List<Card> cards) {
        Set<String> ranks = new HashSet<>();
        for (Card card : cards) ranks.add(card.rank());
        return ranks;
    }

    private static Map<String, Integer> rankCounts(List<Card> hand, List<Card> board) {
        Map<String, Integer> counts = new HashMap<>();
        for (Card card : hand) counts.merge(card.rank(), 1, Integer::sum);
        for (Card card : board) counts.merge(card.rank(), 1, Integer::sum);
        return counts;
    }
}
