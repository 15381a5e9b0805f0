package de.recon.diagnosis.rules.condition;

import de.recon.diagnosis.TradeRows;
import de.recon.diagnosis.model.TradeRow;
import de.recon.diagnosis.rules.RuleConditionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionParserTest {

    private final TradeRow row = TradeRows.trade("T1")
            .set("FundingCurve", "USD-LIBOR")
            .set("ModelVersion", "v2024.2")
            .set("PV_old", null)
            .set("PV_new", 1250.0)
            .set("PV_Mismatch", true)
            .set("Delta_Mismatch", false)
            .build();

    @Test
    void parse_shouldEvaluateConjunctionOfComparisons() {
        Condition c = Condition.parse("FundingCurve == 'USD-LIBOR' and ModelVersion != \"v2024.3\"");

        assertThat(c.test(row)).isTrue();
        assertThat(c.fields()).containsExactlyInAnyOrder("FundingCurve", "ModelVersion");
    }

    @Test
    void parse_shouldHonourPrecedenceOfNotAndOr() {
        // not binds tighter than and, and tighter than or
        assertThat(Condition.parse("not Delta_Mismatch and PV_Mismatch").test(row)).isTrue();
        assertThat(Condition.parse("Delta_Mismatch or PV_Mismatch and FundingCurve == 'USD-LIBOR'").test(row)).isTrue();
        assertThat(Condition.parse("(Delta_Mismatch or PV_Mismatch) and FundingCurve == 'EUR'").test(row)).isFalse();
    }

    @Test
    void nullChecks_shouldSeeNullAndAbsentFields() {
        assertThat(Condition.parse("PV_old is None").test(row)).isTrue();
        assertThat(Condition.parse("NotAColumn is None").test(row)).isTrue();
        assertThat(Condition.parse("PV_new is not None").test(row)).isTrue();
        assertThat(Condition.parse("PV_old is not None").test(row)).isFalse();
    }

    @Test
    void comparisonsAgainstNull_shouldBeFalseInBothForms() {
        assertThat(Condition.parse("PV_old == 5").test(row)).isFalse();
        assertThat(Condition.parse("PV_old != 5").test(row)).isFalse();
        assertThat(Condition.parse("Missing != 'x'").test(row)).isFalse();
    }

    @Test
    void literals_shouldCompareByType() {
        assertThat(Condition.parse("PV_new == 1250").test(row)).isTrue();
        assertThat(Condition.parse("PV_new == 1.25e3").test(row)).isTrue();
        assertThat(Condition.parse("PV_new == '1250'").test(row)).isFalse();
        assertThat(Condition.parse("PV_Mismatch == True").test(row)).isTrue();
        assertThat(Condition.parse("Delta_Mismatch == False").test(row)).isTrue();
        assertThat(Condition.parse("FundingCurve == 'usd-libor'").test(row)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "__import__('os').system('rm -rf /')",
            "import os",
            "len(FundingCurve) == 3",
            "row.FundingCurve == 'USD-LIBOR'",
            "FundingCurve[0] == 'U'",
            "PV_old + 1 == 2",
            "lambda: True",
            "FundingCurve = 'USD-LIBOR'",
            "PV_old == None",
            "FundingCurve == ModelVersion",
            "FundingCurve == 'USD-LIBOR' ModelVersion",
            "(PV_old is None",
            "PV_old is",
            "'abc",
            "",
            "and PV_old is None"
    })
    void parse_shouldRejectEverythingOutsideTheGrammar(String source) {
        assertThatThrownBy(() -> Condition.parse(source))
                .isInstanceOf(RuleConditionException.class);
    }

    @Test
    void parse_shouldReportPositionOfFunctionCall() {
        assertThatThrownBy(() -> Condition.parse("PV_old is None or eval('1')"))
                .isInstanceOf(RuleConditionException.class)
                .satisfies(e -> assertThat(((RuleConditionException) e).getPosition()).isEqualTo(18));
    }

    @Test
    void parse_shouldRejectCallOnPlainIdentifier() {
        assertThatThrownBy(() -> Condition.parse("check(PV_old)"))
                .isInstanceOf(RuleConditionException.class)
                .hasMessageContaining("function calls are not allowed");
    }
}
