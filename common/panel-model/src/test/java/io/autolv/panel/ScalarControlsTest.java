package io.autolv.panel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

final class ScalarControlsTest {

    static Stream<Arguments> rejectedValues() {
        return Stream.of(
            Arguments.of(new NumericControl(attrs("n")), "12"),
            Arguments.of(new BooleanControl(attrs("b")), 1),
            Arguments.of(new StringControl(attrs("s")), 42),
            Arguments.of(new PathControl(attrs("p")), 3.5),
            Arguments.of(new TimestampControl(attrs("t")), ZonedDateTime.now(ZoneOffset.UTC)),
            Arguments.of(new EnumControl(attrs("e")), 1.5),
            Arguments.of(new EnumControl(attrs("e")), "two"),
            Arguments.of(new RingControl(attrs("r"), List.of("Off", "On")), 2),
            Arguments.of(new RingControl(attrs("r"), List.of("Off", "On")), "Maybe"),
            Arguments.of(new RingControl(attrs("r"), List.of("Off", "On")), 0.5),
            Arguments.of(new RingControl(attrs("r"), List.of("Off", "On")), Double.NaN),
            Arguments.of(new IoRefNumControl(ControlKind.VISA_RESOURCE_NAME, attrs("v")), List.of("GPIB0::1", "x")),
            Arguments.of(new ArrayControl(attrs("a")), 7),
            Arguments.of(new ArrayControl(attrs("a")), List.of(1, List.of(2, 3))),
            Arguments.of(new WaveformGraphControl(attrs("w")), List.of("t0", 1, List.of(1, 2)))
        );
    }

    @ParameterizedTest
    @MethodSource("rejectedValues")
    void rejectedValueLeavesPreviousValue(Control<?> control, Object bad) {
        Object before = control.value();

        assertThatThrownBy(() -> control.setValue(bad))
            .isInstanceOf(ControlTypeException.class)
            .hasMessageContaining(control.name());
        assertThat(control.value()).isEqualTo(before);
    }

    @Test
    void numericKeepsAnyNumber() {
        NumericControl numeric = new NumericControl(attrs("n"));

        numeric.setValue(7);
        assertThat(numeric.value()).isEqualTo(7);
        numeric.setValue(2.5f);
        assertThat(numeric.doubleValue()).isEqualTo(2.5);
        numeric.markUnreadable();
        assertThat(numeric.isUnreadable()).isTrue();
    }

    @Test
    void booleanAcceptsOnlyBooleans() {
        BooleanControl flag = new BooleanControl(attrs("flag"));

        flag.setValue(Boolean.TRUE);

        assertThat(flag.isSet()).isTrue();
        assertThat(flag.value()).isTrue();
    }

    @Test
    void pathAcceptsTextAndPaths() {
        PathControl path = new PathControl(attrs("file"));
        assertThat(path.value()).isEmpty();

        path.setValue("data/run.csv");
        assertThat(path.path()).isEqualTo(Path.of("data", "run.csv"));

        path.setValue(Path.of("other.csv"));
        assertThat(path.value()).isEqualTo("other.csv");
    }

    @Test
    void timestampDefaultsToLabviewEpoch() {
        TimestampControl stamp = new TimestampControl(attrs("when"));
        assertThat(stamp.value()).isEqualTo(LocalDateTime.of(1904, 1, 1, 0, 0));

        LocalDateTime now = LocalDateTime.of(2024, 3, 1, 12, 30);
        stamp.setValue(now);
        assertThat(stamp.value()).isEqualTo(now);
    }

    @Test
    void enumCoercesNumericText() {
        EnumControl mode = new EnumControl(attrs("mode"));

        mode.setValue(" 3 ");
        assertThat(mode.value()).isEqualTo(3);
        mode.setValue(4L);
        assertThat(mode.value()).isEqualTo(4);
        mode.setValue(BigInteger.TWO);
        assertThat(mode.value()).isEqualTo(2);
    }

    @Test
    void ringSelectsByIndexOrItem() {
        RingControl ring = new RingControl(attrs("speed"), List.of("Off", "Slow", "Fast"));

        ring.setValue(1);
        assertThat(ring.selectedItem()).isEqualTo("Slow");
        ring.setValue("Fast");
        assertThat(ring.value()).isEqualTo(2);
        assertThat(ring).hasToString("Fast");
    }

    @Test
    void ringTakesWholeDoubleIndexes() {
        RingControl ring = new RingControl(attrs("speed"), List.of("Off", "Slow", "Fast"));

        ring.setValue(2.0);
        assertThat(ring.value()).isEqualTo(2);
        ring.setValue(1.0f);
        assertThat(ring.selectedItem()).isEqualTo("Slow");
    }

    @Test
    void ringWithoutItemsTakesAnyIndex() {
        RingControl ring = new RingControl(attrs("free"), List.of());

        ring.setValue(12);

        assertThat(ring.value()).isEqualTo(12);
        assertThat(ring.selectedItem()).isEqualTo("12");
    }

    @Test
    void ioRefNumTakesLabelsAndPairs() {
        IoRefNumControl resource = new IoRefNumControl(ControlKind.IVI_LOGICAL_NAME, attrs("dmm"));

        resource.setValue("DMM1");
        assertThat(resource.value()).isEqualTo(new IoRefNum("DMM1", 0));
        resource.setValue(List.of("DMM2", 7));
        assertThat(resource.value()).isEqualTo(new IoRefNum("DMM2", 7));
        assertThat(resource.label()).isEqualTo("DMM2");
        assertThat(resource).hasToString("DMM2");
    }

    @Test
    void ioRefNumRejectsOtherKinds() {
        assertThatThrownBy(() -> new IoRefNumControl(ControlKind.STRING, attrs("s")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void arrayNormalisesNestedLists() {
        ArrayControl array = new ArrayControl(attrs("matrix"));

        array.setValue(List.of(List.of(1, 2), List.of(3, 4)));

        assertThat(array.value().shape()).containsExactly(2, 2);
        assertThat(array.value().get(1, 0)).isEqualTo(3.0);
        assertThat(array.value()).isEqualTo(NumericArray.from(new double[][] {{1, 2}, {3, 4}}));
    }

    @Test
    void graphPicksInterpretationByRaggedness() {
        WaveformGraphControl graph = new WaveformGraphControl(attrs("plot"));

        graph.setValue(List.of(1.0, 2.0, 3.0));
        assertThat(graph.isSampled()).isFalse();

        graph.setValue(List.of(0.0, 0.1, List.of(5.0, 6.0)));
        assertThat(graph.isSampled()).isTrue();
        assertThat(graph.value()).isEqualTo(GraphData.sampled(0.0, 0.1, NumericArray.of(5.0, 6.0)));
    }

    @Test
    void unsupportedControlAbsorbsWrites() {
        UnsupportedControl vendor = new UnsupportedControl(attrs("vendor"));

        vendor.setValue(List.of(1, 2, 3));
        vendor.setValue(null);

        assertThat(vendor.value()).isNull();
        assertThat(vendor.isSupported()).isFalse();
        assertThat(vendor).hasToString("Not Implemented");

        vendor.setSupported(true);
        assertThat(vendor.isSupported()).isTrue();
    }

    @Test
    void dataflowParsesDirections() {
        NumericControl numeric = new NumericControl(attrs("n"));

        numeric.setDataflow("out");
        assertThat(numeric.dataflow()).isEqualTo(DataFlow.INDICATOR);
        numeric.setDataflow("Control");
        assertThat(numeric.dataflow()).isEqualTo(DataFlow.CONTROL);
        assertThatThrownBy(() -> numeric.setDataflow("sideways")).isInstanceOf(IllegalArgumentException.class);
    }

    private static ControlAttributes attrs(String name) {
        return ControlAttributes.named(name);
    }
}
