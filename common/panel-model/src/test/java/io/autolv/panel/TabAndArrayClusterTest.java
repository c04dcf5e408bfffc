package io.autolv.panel;

import static io.autolv.panel.ClusterControlTest.bool;
import static io.autolv.panel.ClusterControlTest.cluster;
import static io.autolv.panel.ClusterControlTest.numeric;
import static io.autolv.panel.ClusterControlTest.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

final class TabAndArrayClusterTest {

    @Test
    void tabValueIsTheSelectedPage() {
        TabControl tabs = tabs();

        tabs.setValue("Results");
        assertThat(tabs.value()).isEqualTo(1);
        assertThat(tabs).hasToString("Results");

        tabs.setValue(0);
        assertThat(tabs.value()).isZero();
    }

    @Test
    void tabRejectsUnknownPages() {
        TabControl tabs = tabs();

        assertThatThrownBy(() -> tabs.setValue("Debug")).isInstanceOf(ControlTypeException.class);
        assertThatThrownBy(() -> tabs.setValue(5)).isInstanceOf(ControlTypeException.class);
        assertThatThrownBy(() -> tabs.page("Debug")).isInstanceOf(UnknownControlException.class);
        assertThat(tabs.value()).isZero();
    }

    @Test
    void tabControlsAreFlattenedPageByPage() {
        TabControl tabs = tabs();

        assertThat(tabs.controls()).extracting(Control::name).containsExactly("gain", "offset", "done");
        assertThat(tabs.find("offset")).isPresent();
        assertThat(tabs.find("missing")).isEmpty();
    }

    @Test
    void arrayClusterCannotBeAssignedDirectly() {
        ArrayClusterControl points = points();

        assertThatThrownBy(() -> points.setValue(List.of(List.of(1.0, 2.0))))
            .isInstanceOf(ControlTypeException.class)
            .hasMessageContaining("replaceElements");
    }

    @Test
    void arrayClusterInstallsElementsWithTheLayout() {
        ArrayClusterControl points = points();
        ClusterControl first = points.newElement();
        first.setValue(List.of(1.0, 2.0));
        ClusterControl second = points.newElement();
        second.setValue(List.of(3.0, 4.0));

        points.replaceElements(List.of(first, second));

        assertThat(points.size()).isEqualTo(2);
        assertThat(points.get(1).get("y").value()).isEqualTo(4.0);
        assertThat(points.values()).isEqualTo(List.of(List.of(1.0, 2.0), List.of(3.0, 4.0)));
    }

    @Test
    void arrayClusterRejectsForeignElements() {
        ArrayClusterControl points = points();

        assertThatThrownBy(() -> points.replaceElements(List.of(cluster("other", bool("flag")))))
            .isInstanceOf(ControlTypeException.class)
            .hasMessageContaining("[x, y]");
        assertThat(points.value()).isEmpty();
        assertThatThrownBy(() -> points.get(0)).isInstanceOf(UnknownControlException.class);
    }

    @Test
    void errorClusterElementsMayUseTheCanonicalOrder() {
        ArrayClusterControl errors = new ArrayClusterControl(
            ControlAttributes.named("errors"), () -> cluster("error", numeric("code"), text("source"), bool("status")));
        ClusterControl element = errors.newElement();
        element.setValue(List.of(true, 5003, "VISA Open"));

        errors.replaceElements(List.of(element));

        assertThat(errors.get(0).names()).containsExactly("status", "code", "source");
        assertThat(errors.layout()).containsExactly("code", "source", "status");
        assertThat(errors.values()).isEqualTo(List.of(List.of(true, 5003, "VISA Open")));
    }

    private static TabControl tabs() {
        TabPage setup = new TabPage("Setup", List.of(numeric("gain"), numeric("offset")));
        TabPage results = new TabPage("Results", List.of(bool("done")));
        return new TabControl(ControlAttributes.named("tabs"), List.of(setup, results));
    }

    private static ArrayClusterControl points() {
        return new ArrayClusterControl(
            ControlAttributes.named("points"), () -> cluster("point", numeric("x"), numeric("y")));
    }
}
