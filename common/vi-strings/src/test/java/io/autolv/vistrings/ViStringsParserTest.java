package io.autolv.vistrings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.autolv.panel.ControlDefinition;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

final class ViStringsParserTest {

    private static ViStringsDocument document;

    @BeforeAll
    static void parseFixture() throws IOException {
        document = new ViStringsParser().parse(RepairPassTest.fixture());
    }

    @Test
    void readsViHeader() {
        assertThat(document.name()).contains("demo.vi");
        assertThat(document.version()).contains("20008000");
    }

    @Test
    void keepsExportOrderAndFlattensGroupers() {
        assertThat(document.definitions().keySet()).containsExactly(
            "volts", "note", "speed", "settings", "error in", "tabs", "samples", "points", "limits", "bus",
            "started", "instrument", "trace");
    }

    @Test
    void collectsAttributesDescriptionAndParts() {
        ControlDefinition volts = definition("volts");

        assertThat(volts.type()).isEqualTo("Numeric");
        assertThat(volts.id()).isEqualTo(80);
        assertThat(volts.text(ControlDefinition.DESCRIPTION)).contains("input voltage");
        assertThat(volts.text(ControlDefinition.TIP)).contains("volts & amps");
        assertThat(volts.text(ControlDefinition.CAPTION)).contains("Supply");
        assertThat(volts.text(ControlDefinition.UNIT_LABEL)).contains("V");
        assertThat(volts.text("namelabel")).contains("volts");
    }

    @Test
    void decodesLabviewEscapes() {
        ControlDefinition note = definition("note");

        assertThat(note.text(ControlDefinition.DESCRIPTION)).contains("x < y > z");
        assertThat(note.text(ControlDefinition.TIP)).contains("say \"hi\" to channel __1__");
        assertThat(note.has(ControlDefinition.CAPTION)).isFalse();
    }

    @Test
    void ringKeepsItemsAndLineBreaks() {
        ControlDefinition speed = definition("speed");

        assertThat(speed.items()).containsExactly("Off", "Slow", "Fast");
        assertThat(speed.text(ControlDefinition.DESCRIPTION)).contains("first line\nsecond line");
        assertThat(speed.has(ControlDefinition.TIP)).isFalse();
    }

    @Test
    void clusterMembersKeepDeclaredOrder() {
        assertThat(definition("settings").members().keySet()).containsExactly("gain", "enabled");
        assertThat(definition("settings").has("text")).isFalse();
        assertThat(definition("error in").members().keySet()).containsExactly("code", "source", "status");
    }

    @Test
    void tabPagesAreNamedByCaption() {
        Map<String, Map<String, ControlDefinition>> pages = definition("tabs").pages();

        assertThat(pages.keySet()).containsExactly("Setup", "Results");
        assertThat(pages.get("Setup").keySet()).containsExactly("offset");
        assertThat(pages.get("Results").keySet()).containsExactly("done", "summary");
    }

    @Test
    void arrayOfNumbersRemembersItsElementType() {
        ControlDefinition samples = definition("samples");

        assertThat(samples.type()).isEqualTo("Array");
        assertThat(samples.text("elementtype")).contains("Numeric");
        assertThat(samples.element()).isEmpty();
    }

    @Test
    void arrayOfClustersIsRetyped() {
        ControlDefinition points = definition("points");

        assertThat(points.type()).isEqualTo("ArrayCluster");
        assertThat(points.element()).get()
            .satisfies(element -> assertThat(element.members().keySet()).containsExactly("x", "y"));
    }

    @Test
    void typeDefinitionIsUnwrapped() {
        ControlDefinition limits = definition("limits");

        assertThat(limits.type()).isEqualTo("Cluster");
        assertThat(limits.name()).isEqualTo("limits");
        assertThat(limits.text(ControlDefinition.DESCRIPTION)).contains("operating limits");
        assertThat(limits.text(ControlDefinition.TIP)).contains("from the limits typedef");
        assertThat(limits.members().keySet()).containsExactly("low", "high");
    }

    @Test
    void unknownTypesAreStillExtracted() {
        assertThat(definition("bus").type()).isEqualTo("Digital Waveform Graph");
    }

    @Test
    void malformedTextReportsLocation() {
        String broken = "<VI name=\"x.vi\">\n<CONTENT>\n<CONTROL ID=1 type=\"Numeric\" name=\"n\">\n</CONTENT>\n</VI>";

        assertThatThrownBy(() -> new ViStringsParser().parse(broken))
            .isInstanceOfSatisfying(ViStringsFormatException.class, ex -> {
                assertThat(ex.hasLocation()).isTrue();
                assertThat(ex.line()).isEqualTo(4);
                assertThat(ex.excerpt()).contains("CONTENT");
            });
    }

    @Test
    void equalsSignsInTextSurviveRepair() {
        String export = vi("<CONTROL ID=1 type=\"Numeric\" name=\"gain\"><DESC>default gain=2</DESC>"
            + "<TIP>set k=3 for x=y</TIP><PARTS></PARTS></CONTROL>");

        ControlDefinition gain = new ViStringsParser().parse(export).definition("gain").orElseThrow();

        assertThat(gain.text(ControlDefinition.DESCRIPTION)).contains("default gain=2");
        assertThat(gain.text(ControlDefinition.TIP)).contains("set k=3 for x=y");
    }

    @Test
    void missingDescriptionIsAFormatError() {
        String export = vi("<CONTROL ID=1 type=\"Numeric\" name=\"n\"><TIP></TIP><PARTS></PARTS></CONTROL>");

        assertThatThrownBy(() -> new ViStringsParser().parse(export))
            .isInstanceOf(ViStringsFormatException.class)
            .hasMessageContaining("CONTROL 'n' has no DESC");
    }

    @Test
    void missingPartsIsAFormatError() {
        String export = vi("<CONTROL ID=1 type=\"Numeric\" name=\"n\"><DESC></DESC><TIP></TIP></CONTROL>");

        assertThatThrownBy(() -> new ViStringsParser().parse(export))
            .isInstanceOf(ViStringsFormatException.class)
            .hasMessageContaining("PARTS");
    }

    @Test
    void typeDefinitionWithoutControlIsAFormatError() {
        String export = vi("<CONTROL ID=1 type=\"Type Definition\" name=\"td\"><DESC></DESC><TIP></TIP>"
            + "<PARTS><PART ID=11 type=\"Name Label\"></PART></PARTS></CONTROL>");

        assertThatThrownBy(() -> new ViStringsParser().parse(export))
            .isInstanceOf(ViStringsFormatException.class)
            .hasMessageContaining("td");
    }

    @Test
    void arrayWithoutElementIsAFormatError() {
        String export = vi("<CONTROL ID=1 type=\"Array\" name=\"arr\"><DESC></DESC><TIP></TIP><CONTENT></CONTENT></CONTROL>");

        assertThatThrownBy(() -> new ViStringsParser().parse(export))
            .isInstanceOf(ViStringsFormatException.class)
            .hasMessageContaining("CONTROL");
    }

    @Test
    void tabCaptionCountMustMatchPages() {
        String export = vi("<CONTROL ID=1 type=\"Tab Control\" name=\"tabs\"><DESC></DESC><TIP></TIP>"
            + "<PRIV><PAGE_CAPTIONS><STRING>One</STRING></PAGE_CAPTIONS></PRIV><PAGE></PAGE><PAGE></PAGE></CONTROL>");

        assertThatThrownBy(() -> new ViStringsParser().parse(export))
            .isInstanceOf(ViStringsFormatException.class)
            .hasMessageContaining("1 page captions for 2 pages");
    }

    @Test
    void rootMustBeVi() {
        assertThatThrownBy(() -> new ViStringsParser().parse("<PANEL><CONTENT></CONTENT></PANEL>"))
            .isInstanceOf(ViStringsFormatException.class)
            .hasMessageContaining("<VI>");
        assertThatThrownBy(() -> new ViStringsParser().parse("   "))
            .isInstanceOf(ViStringsFormatException.class);
    }

    @Test
    void doctypeIsRejected() {
        String export = "<!DOCTYPE VI [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><VI><CONTENT></CONTENT></VI>";

        assertThatThrownBy(() -> new ViStringsParser().parse(export)).isInstanceOf(ViStringsFormatException.class);
    }

    private static ControlDefinition definition(String name) {
        return document.definition(name).orElseThrow();
    }

    private static String vi(String controls) {
        return "<VI name=\"t.vi\">\n<CONTENT>\n" + controls + "\n</CONTENT>\n</VI>\n";
    }
}
