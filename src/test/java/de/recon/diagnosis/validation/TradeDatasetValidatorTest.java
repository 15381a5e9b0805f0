package de.recon.diagnosis.validation;

import de.recon.diagnosis.TradeRows;
import de.recon.diagnosis.model.Columns;
import de.recon.diagnosis.model.TradeDataset;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradeDatasetValidatorTest {

    private final TradeDatasetValidator validator = new TradeDatasetValidator();

    @Test
    void validate_shouldAcceptCompleteDataset() {
        TradeDataset dataset = new TradeDataset(List.of(TradeRows.swap("T1").build(), TradeRows.swap("T2").build()));

        assertThatCode(() -> validator.validate(dataset)).doesNotThrowAnyException();
    }

    @Test
    void validate_shouldRejectEmptyDataset() {
        assertThatThrownBy(() -> validator.validate(new TradeDataset(List.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void validate_shouldNameTheMissingColumn() {
        TradeDataset dataset = new TradeDataset(List.of(TradeRows.swap("T1").remove(Columns.MODEL_VERSION).build()));

        assertThatThrownBy(() -> validator.validate(dataset))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(Columns.MODEL_VERSION);
    }

    @Test
    void validate_shouldRejectRowWithoutTradeId() {
        TradeDataset dataset = new TradeDataset(List.of(
                TradeRows.swap("T1").build(),
                TradeRows.swap("T2").set(Columns.TRADE_ID, " ").build()));

        assertThatThrownBy(() -> validator.validate(dataset))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(Columns.TRADE_ID);
    }
}
