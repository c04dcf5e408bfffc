package io.autolv.panel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

final class RaggednessTest {

    @Test
    void flatAndRectangularSequencesAreNotRagged() {
        assertThat(Raggedness.isRagged(List.of(1, 2, 3))).isFalse();
        assertThat(Raggedness.isRagged(List.of(List.of(1, 2), List.of(3, 4)))).isFalse();
        assertThat(Raggedness.isRagged(List.of())).isFalse();
        assertThat(Raggedness.isRagged(new int[] {1, 2})).isFalse();
    }

    @Test
    void mixedDepthsAreRagged() {
        assertThat(Raggedness.isRagged(List.of(1, 2, List.of(3, 4)))).isTrue();
    }

    @Test
    void deepLengthMismatchIsRagged() {
        Object value = List.of(
            List.of(List.of(1, 2), List.of(3, 4)),
            List.of(List.of(1, 2), List.of(3, 4, 5)));

        assertThat(Raggedness.isRagged(value)).isTrue();
    }

    @Test
    void cousinsAtTheSameDepthAreCompared() {
        Object value = List.of(List.of(List.of(1, 2)), List.of(List.of(1, 2, 3)));

        assertThat(Raggedness.isRagged(value)).isTrue();
    }

    @Test
    void scalarsAndTextAreNeverRagged() {
        assertThat(Raggedness.isRagged(4.0)).isFalse();
        assertThat(Raggedness.isRagged("abc")).isFalse();
        assertThat(Raggedness.isRagged(null)).isFalse();
    }

    @Test
    void numericArrayRejectsNonNumbersAndText() {
        assertThatThrownBy(() -> NumericArray.from(List.of("a", "b")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a number");
        assertThatThrownBy(() -> NumericArray.from("123")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NumericArray.from(new boolean[] {true})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void numericArrayRoundsTripsThroughNestedLists() {
        NumericArray array = NumericArray.from(List.of(List.of(1, 2, 3), List.of(4, 5, 6)));

        assertThat(array.rank()).isEqualTo(2);
        assertThat(array.size()).isEqualTo(6);
        assertThat(array.toList()).isEqualTo(List.of(List.of(1.0, 2.0, 3.0), List.of(4.0, 5.0, 6.0)));
        assertThat(array.toDoubleArray()).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void graphDataRejectsRaggedValuesThatAreNotTriples() {
        assertThatThrownBy(() -> GraphData.from(List.of(1, List.of(2, 3))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("(t0, dt, Y)");
    }
}
