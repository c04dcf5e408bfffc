package io.autolv.panel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class ControlAttributesTest {

    @Test
    void copiesScalarAttributesOnly() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("ID", "83");
        raw.put("type", "Ring");
        raw.put("name", "speed");
        raw.put("description", "fan speed");
        raw.put("namelabel", "speed");
        raw.put("items", List.of("a"));
        raw.put("value", 0);

        ControlAttributes attributes = ControlAttributes.from(ControlDefinition.of(raw));

        assertThat(attributes.id()).isEqualTo(83);
        assertThat(attributes.description()).contains("fan speed");
        assertThat(attributes.get("namelabel")).contains("speed");
        assertThat(attributes.asMap()).doesNotContainKeys("items", "value");
    }

    @Test
    void emptyAttributesCanBeFilledOnce() {
        NumericControl numeric = new NumericControl(ControlAttributes.named("volts"));

        numeric.setDescription("supply voltage");
        numeric.setUnitLabel("V");

        assertThat(numeric.description()).contains("supply voltage");
        assertThat(numeric.unitLabel()).contains("V");
        assertThatThrownBy(() -> numeric.setDescription("other"))
            .isInstanceOf(ImmutableAttributeException.class)
            .hasMessageContaining("description");
    }

    @Test
    void nameCannotBeReassigned() {
        NumericControl numeric = new NumericControl(ControlAttributes.named("volts"));

        assertThatThrownBy(() -> numeric.setAttribute(ControlDefinition.NAME, "amps"))
            .isInstanceOf(ImmutableAttributeException.class);
        assertThat(numeric.name()).isEqualTo("volts");
        assertThat(numeric.attributes().isReadOnly(ControlDefinition.NAME)).isTrue();
    }

    @Test
    void declaredTypeFallsBackToKindLabel() {
        assertThat(new StringControl(ControlAttributes.named("s")).declaredType()).isEqualTo("String");
    }

    @Test
    void definitionWithoutNameIsRejected() {
        ControlDefinition definition = ControlDefinition.of(Map.of("type", "Numeric"));

        assertThatThrownBy(definition::name).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void controlsWithSameShapeAndValueAreEqual() {
        NumericControl first = new NumericControl(ControlAttributes.named("n"));
        NumericControl second = new NumericControl(ControlAttributes.named("n"));
        second.setValue(0.0);

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        second.setValue(1.0);
        assertThat(first).isNotEqualTo(second);
    }
}
