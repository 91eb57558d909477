package com.tableadvisor.common.parser;

import com.tableadvisor.common.model.ActionKind;
import com.tableadvisor.common.model.ClassifiedResponse;
import com.tableadvisor.common.model.ConsistencyVerdict;
import com.tableadvisor.common.model.FieldKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end classification of model responses: fields, action, sizing, reconciliation.
 */
class ResponseParserTest {

    // ── edges ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("parse() — edge input")
    class EdgeTests {

        @Test
        @DisplayName("blank text → WAITING with empty fields")
        void blank_isWaiting() {
            ClassifiedResponse r = ResponseParser.parse("   \n ");
            assertEquals(ActionKind.WAITING, r.actionKind());
            assertEquals("Not your turn", r.displayText());
            assertTrue(r.fields().isEmpty());
        }

        @Test
        @DisplayName("null text → WAITING")
        void null_isWaiting() {
            assertEquals(ActionKind.WAITING, ResponseParser.parse(null).actionKind());
        }

        @Test
        @DisplayName("no labels → whole text is the rationale and drives detection")
        void unlabelled_wholeTextIsRationale() {
            ClassifiedResponse r = ResponseParser.parse("I think you should fold here");
            assertEquals(ActionKind.FOLD, r.actionKind());
            assertEquals("Fold", r.displayText());
            assertEquals("I think you should fold here", r.fields().get(FieldKey.RATIONALE));
        }

        @Test
        @DisplayName("unrecognized action echoes the first 20 characters")
        void unrecognized_isTruncated() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: something quite unexpected happened");
            assertEquals(ActionKind.UNRECOGNIZED, r.actionKind());
            assertEquals("something quite unex...", r.displayText());
        }

        @Test
        @DisplayName("short unrecognized action is echoed whole")
        void unrecognized_short() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: ???");
            assertEquals(ActionKind.UNRECOGNIZED, r.actionKind());
            assertEquals("???", r.displayText());
        }

        @Test
        @DisplayName("SKIP → empty display")
        void skip() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: SKIP");
            assertEquals(ActionKind.SKIP, r.actionKind());
            assertEquals("", r.displayText());
        }
    }

    // ── action detection ─────────────────────────────────────────────────

    @Nested
    @DisplayName("parse() — action detection")
    class ActionTests {

        @Test
        @DisplayName("round trip: ACTION: RAISE 120 / POT: 80 → RAISE, 'Raise 120'")
        void roundTrip_raiseWithAmount() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: RAISE 120\nPOT: 80\n...");
            assertEquals(ActionKind.RAISE, r.actionKind());
            assertEquals("Raise 120", r.displayText());
            assertEquals("80", r.fields().get(FieldKey.POT));
        }

        @Test
        @DisplayName("all-in outranks raise in the same action line")
        void allInPrecedence() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: ALL-IN (raise all)");
            assertEquals(ActionKind.ALL_IN, r.actionKind());
            assertEquals("All-in", r.displayText());
        }

        @Test
        @DisplayName("raise outranks call")
        void raiseOutranksCall() {
            assertEquals(ActionKind.RAISE, ResponseParser.parse("ACTION: CALL or RAISE").actionKind());
        }

        @Test
        @DisplayName("'better' is not read as a bet")
        void wholeWordKeywords() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: CHECK (better to keep it small)");
            assertEquals(ActionKind.CHECK, r.actionKind());
            assertEquals("Check", r.displayText());
        }

        @Test
        @DisplayName("Chinese action keyword with amount")
        void chineseRaise() {
            ClassifiedResponse r = ResponseParser.parse("ACTION：加注 200\n底池：300");
            assertEquals(ActionKind.RAISE, r.actionKind());
            assertEquals("Raise 200", r.displayText());
        }

        @Test
        @DisplayName("first recognised ACTION occurrence decides")
        void firstRecognisedActionWins() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: hmm\nACTION: CALL");
            assertEquals(ActionKind.CALL, r.actionKind());
        }

        @Test
        @DisplayName("fields on one line do not leak into the action")
        void oneLineFields() {
            ClassifiedResponse r = ResponseParser.parse("HAND: Ah Kd BOARD: Ac 7h 2d ACTION: CALL");
            assertEquals(ActionKind.CALL, r.actionKind());
            assertEquals("Ah Kd", r.fields().get(FieldKey.HAND));
            assertEquals("Ac 7h 2d", r.fields().get(FieldKey.BOARD));
        }

        @Test
        @DisplayName("TO CALL label is not mistaken for a call")
        void toCallLabelMasked() {
            ClassifiedResponse r = ResponseParser.parse("TO CALL: 40\nthinking about it");
            assertEquals(ActionKind.UNRECOGNIZED, r.actionKind());
            assertEquals("40", r.fields().get(FieldKey.AMOUNT_TO_CALL));
        }
    }

    // ── raise sizing ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("parse() — raise sizing")
    class SizingTests {

        @Test
        @DisplayName("RAISE SIZE field: number after '=' wins")
        void sizeField_afterEquals() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: RAISE\nRAISE SIZE: pot 2/3 = 400\nPOT: 600");
            assertEquals("Raise 400", r.displayText());
        }

        @Test
        @DisplayName("RAISE SIZE field: fractions are skipped, last standalone number used")
        void sizeField_skipsFraction() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: RAISE\nRAISE SIZE: 2/3 pot, about 350");
            assertEquals("Raise 350", r.displayText());
        }

        @Test
        @DisplayName("no explicit amount → two thirds of the pot")
        void potFallback() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: RAISE\nPOT: 90");
            assertEquals("Raise 60", r.displayText());
        }

        @Test
        @DisplayName("nothing to size from → bare 'Raise'")
        void bareRaise() {
            assertEquals("Raise", ResponseParser.parse("ACTION: RAISE").displayText());
        }

        @Test
        @DisplayName("'raise to 300' in free text")
        void raiseTo() {
            ClassifiedResponse r = ResponseParser.parse("Raise to 300 looks best");
            assertEquals(ActionKind.RAISE, r.actionKind());
            assertEquals("Raise 300", r.displayText());
        }
    }

    // ── predicted turn ───────────────────────────────────────────────────

    @Nested
    @DisplayName("parse() — predicted action")
    class PredictedTests {

        @Test
        @DisplayName("WAITING with a concrete PREDICTED action → READY 'Predicted: Call'")
        void waitingWithPrediction_becomesReady() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: WAITING\nPREDICTED: CALL");
            assertEquals(ActionKind.READY, r.actionKind());
            assertEquals("Predicted: Call", r.displayText());
            assertEquals("CALL", r.fields().get(FieldKey.PREDICTED_ACTION));
        }

        @Test
        @DisplayName("predicted raise is sized from PREDICTED RAISE SIZE")
        void predictedRaise_sized() {
            ClassifiedResponse r = ResponseParser.parse(
                "ACTION: WAIT\nPREDICTED: RAISE\nPREDICTED RAISE SIZE: 250");
            assertEquals(ActionKind.READY, r.actionKind());
            assertEquals("Predicted: Raise 250", r.displayText());
        }

        @Test
        @DisplayName("WAITING without prediction stays WAITING")
        void waitingWithoutPrediction() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: WAITING");
            assertEquals(ActionKind.WAITING, r.actionKind());
            assertEquals("Not your turn", r.displayText());
        }

        @Test
        @DisplayName("bare READY picks up an advisory phrase")
        void readyWithHint() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: READY\nANALYSIS: 建议跟注");
            assertEquals(ActionKind.READY, r.actionKind());
            assertEquals("Predicted: Call", r.displayText());
        }

        @Test
        @DisplayName("bare READY without a hint → 'Get ready'")
        void readyWithoutHint() {
            assertEquals("Get ready", ResponseParser.parse("ACTION: READY").displayText());
        }
    }

    // ── contradiction reconciliation ─────────────────────────────────────

    @Nested
    @DisplayName("parse() — rationale vs declared action")
    class ContradictionTests {

        @Test
        @DisplayName("rationale recommending fold overrides a raise")
        void foldRecommendation_overridesRaise() {
            ClassifiedResponse r = ResponseParser.parse(
                "ACTION: RAISE 200\nANALYSIS: Villain range is strong, you should fold.");
            assertEquals(ActionKind.FOLD, r.actionKind());
            assertEquals("Fold", r.displayText());
        }

        @Test
        @DisplayName("call recommendation overrides a raise")
        void callRecommendation_overridesRaise() {
            ClassifiedResponse r = ResponseParser.parse(
                "ACTION: RAISE 300\nANALYSIS: pot odds are fine, I recommend calling here.");
            assertEquals(ActionKind.CALL, r.actionKind());
        }

        @Test
        @DisplayName("bet recommendation overrides a check and is re-sized from the pot")
        void betRecommendation_overridesCheck() {
            ClassifiedResponse r = ResponseParser.parse(
                "ACTION: CHECK\nPOT: 300\nANALYSIS: strong hand, you should bet for value.");
            assertEquals(ActionKind.RAISE, r.actionKind());
            assertEquals("Raise 200", r.displayText());
        }

        @Test
        @DisplayName("fold stickiness: FOLD is never changed by the rationale")
        void foldIsTerminal() {
            ClassifiedResponse r = ResponseParser.parse(
                "ACTION: FOLD\nANALYSIS: some would say you should raise, or go all-in.");
            assertEquals(ActionKind.FOLD, r.actionKind());
            assertEquals("Fold", r.displayText());
        }

        @Test
        @DisplayName("conclusive fold phrase converts an acting kind")
        void foldPhrase() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: CALL\nANALYSIS: 牌力太弱，只能弃牌");
            assertEquals(ActionKind.FOLD, r.actionKind());
        }

        @Test
        @DisplayName("agreeing rationale leaves the action alone")
        void agreement() {
            ClassifiedResponse r = ResponseParser.parse(
                "ACTION: RAISE 150\nANALYSIS: strong draw, you should raise.");
            assertEquals(ActionKind.RAISE, r.actionKind());
            assertEquals("Raise 150", r.displayText());
        }
    }

    // ── consistency ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("parse() — consistency verdict")
    class ConsistencyTests {

        @Test
        @DisplayName("false top-pair claim → LOW, action unchanged")
        void falseTopPair_isLow() {
            ClassifiedResponse r = ResponseParser.parse(
                "ACTION: CALL\nHAND: Ah Kd\nBOARD: Qs 7c 2h\nANALYSIS: top pair of aces, call.");
            assertEquals(ActionKind.CALL, r.actionKind());
            assertEquals(ConsistencyVerdict.Level.LOW, r.consistency().confidence());
            assertFalse(r.consistency().issue().isEmpty());
        }

        @Test
        @DisplayName("no rationale → MEDIUM")
        void noRationale_isMedium() {
            ClassifiedResponse r = ResponseParser.parse("ACTION: CALL\nHAND: Ah Kd");
            assertEquals(ConsistencyVerdict.Level.MEDIUM, r.consistency().confidence());
        }
    }

    // ── streaming helpers ────────────────────────────────────────────────

    @Nested
    @DisplayName("streaming helpers")
    class StreamingTests {

        @Test
        @DisplayName("declaresAction needs a recognised keyword after ACTION")
        void declaresAction() {
            assertFalse(ResponseParser.declaresAction("ACTION: RAI"));
            assertFalse(ResponseParser.declaresAction("HAND: Ah Kd"));
            assertTrue(ResponseParser.declaresAction("ACTION: RAISE"));
        }

        @Test
        @DisplayName("rationaleStarted is true as soon as the label arrives")
        void rationaleStarted() {
            assertFalse(ResponseParser.rationaleStarted("ACTION: RAISE\nHAND: Ah Kd"));
            assertTrue(ResponseParser.rationaleStarted("ACTION: RAISE\nANALYSIS:"));
            assertTrue(ResponseParser.rationaleStarted("ACTION: RAISE\n分析：对手很弱"));
        }
    }
}
