package com.tableadvisor.common.parser;

import com.tableadvisor.common.model.FieldKey;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Every label the model is prompted to emit, with the spellings it is known to use.
 *
 * <p>The provider prompt is bilingual, so each label accepts its English spelling and
 * the Chinese one. {@link #ACTION} carries no {@link FieldKey}; its value feeds action
 * detection rather than the field set.
 */
public enum FieldLabel {
    ACTION(null, "ACTION", "行动"),
    HAND(FieldKey.HAND, "HAND", "HOLE CARDS", "手牌"),
    BOARD(FieldKey.BOARD, "BOARD", "COMMUNITY CARDS", "公共牌"),
    STAGE(FieldKey.STAGE, "STAGE", "STREET", "阶段"),
    POSITION(FieldKey.POSITION, "POSITION", "位置"),
    POT(FieldKey.POT, "POT", "底池"),
    AMOUNT_TO_CALL(FieldKey.AMOUNT_TO_CALL, "TO CALL", "CALL AMOUNT", "跟注"),
    POT_ODDS(FieldKey.POT_ODDS, "POT ODDS", "ODDS", "赔率"),
    STACK_TO_POT_RATIO(FieldKey.STACK_TO_POT_RATIO, "SPR"),
    RATIONALE(FieldKey.RATIONALE, "ANALYSIS", "RATIONALE", "分析"),
    RAISE_SIZE(FieldKey.RAISE_SIZE, "RAISE SIZE", "RAISE AMOUNT", "加注额"),
    PREDICTED_ACTION(FieldKey.PREDICTED_ACTION, "PREDICTED", "PREDICTED ACTION", "预判"),
    PREDICTED_RAISE_SIZE(FieldKey.PREDICTED_RAISE_SIZE, "PREDICTED RAISE SIZE", "预判加注额");

    private final FieldKey key;
    private final List<String> spellings;

    FieldLabel(FieldKey key, String... spellings) {
        this.key = key;
        this.spellings = List.of(spellings);
    }

    public FieldKey key() {
        return key;
    }

    public List<String> spellings() {
        return spellings;
    }

    /** One (label, spelling) pair; used to try longer spellings first. */
    record Spelling(FieldLabel label, String text) {}

    /** All spellings of all labels, longest first, so no label is read as a prefix of another. */
    static final List<Spelling> BY_LENGTH_DESC = Arrays.stream(values())
        .flatMap(label -> label.spellings.stream().map(s -> new Spelling(label, s)))
        .sorted(Comparator.comparingInt((Spelling s) -> s.text().length()).reversed())
        .toList();
}
