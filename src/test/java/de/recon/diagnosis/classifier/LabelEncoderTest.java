package de.recon.diagnosis.classifier;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabelEncoderTest {

    @Test
    void fit_shouldOrderLabelsNaturallyAndDropDuplicates() {
        LabelEncoder encoder = LabelEncoder.fit(List.of("b", "a", "c", "a"));

        assertThat(encoder.labels()).containsExactly("a", "b", "c");
        assertThat(encoder.encode("b")).isEqualTo(1);
        assertThat(encoder.decode(2)).isEqualTo("c");
    }

    @Test
    void fit_shouldEncodeTheSameSetIdenticallyRegardlessOfInputOrder() {
        LabelEncoder first = LabelEncoder.fit(List.of("x", "y", "z"));
        LabelEncoder second = LabelEncoder.fit(List.of("z", "x", "y"));

        assertThat(first.labels()).isEqualTo(second.labels());
    }

    @Test
    void encode_shouldRejectUnknownLabel() {
        LabelEncoder encoder = LabelEncoder.fit(List.of("a"));

        assertThatThrownBy(() -> encoder.encode("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void decode_shouldFailForIndexOutsideEncoder() {
        LabelEncoder encoder = LabelEncoder.fit(List.of("a", "b"));

        assertThatThrownBy(() -> encoder.decode(2)).isInstanceOf(ModelStateException.class);
        assertThatThrownBy(() -> encoder.decode(-1)).isInstanceOf(ModelStateException.class);
    }

    @Test
    void restore_shouldKeepPersistedOrderAndRejectDuplicates() {
        assertThat(LabelEncoder.restore(List.of("b", "a")).encode("b")).isZero();

        assertThatThrownBy(() -> LabelEncoder.restore(List.of("a", "a")))
                .isInstanceOf(ModelStateException.class);
    }
}
