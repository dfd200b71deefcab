package io.imagexform.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.error.ImageXformException.Phase;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OperationArgsTest {

    @Test
    void readsIntegersFromNumbersAndStrings() {
        OperationArgs args = new OperationArgs("crop", Arrays.asList(10, 20L, "30", 40.0), Map.of());

        assertThat(args.requireInt(0)).isEqualTo(10);
        assertThat(args.requireInt(1)).isEqualTo(20);
        assertThat(args.requireInt(2)).isEqualTo(30);
        assertThat(args.requireInt(3)).isEqualTo(40);
        assertThat(args.intOrNull(4)).isNull();
    }

    @Test
    void fractionalValueIsNotAnInteger() {
        OperationArgs args = new OperationArgs("crop", Arrays.asList(10.5), Map.of());

        assertThatThrownBy(() -> args.requireInt(0))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("crop");
    }

    @Test
    void missingRequiredArgumentFailsInTransformPhase() {
        OperationArgs args = new OperationArgs("rotate", Arrays.asList(), Map.of());

        assertThatThrownBy(() -> args.requireDouble(0))
                .isInstanceOf(ConfigurationException.class)
                .extracting(e -> ((ConfigurationException) e).phase())
                .isEqualTo(Phase.TRANSFORM);
    }

    @Test
    void namedOptions() {
        OperationArgs args = new OperationArgs("resize_and_pad", Arrays.asList(100, 100), Map.of("gravity", "north"));

        assertThat(args.hasOption("gravity")).isTrue();
        assertThat(args.optionString("gravity", "center")).isEqualTo("north");
        assertThat(args.optionString("background", "transparent")).isEqualTo("transparent");
        assertThat(args.optionInt("offset")).isNull();
    }
}
