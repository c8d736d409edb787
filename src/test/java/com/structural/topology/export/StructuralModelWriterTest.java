package com.structural.topology.export;

import static com.structural.topology.generator.TopologyFixtures.grid;
import static com.structural.topology.generator.TopologyFixtures.plates;
import static com.structural.topology.generator.TopologyFixtures.truss;
import static com.structural.topology.generator.TopologyFixtures.warehouse;
import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.io.TempDir;

import com.structural.topology.generator.TopologyGenerator;
import com.structural.topology.model.GenerationResult;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.TopologyKind;

/**
 * Tests for rendering generated topologies as structural command files.
 */
class StructuralModelWriterTest {

    @TempDir
    Path tempDir;

    private final TopologyGenerator generator = new TopologyGenerator();
    private final StructuralModelWriter writer = new StructuralModelWriter();

    private GenerationResult smallWarren() {
        // bottom 1..3, top 4..5; members: bottom 1-2, top 3, diagonals 4-7
        return generator.generate(TopologyKind.WARREN_TRUSS, truss(10.0, 2.0, 2));
    }

    @Test
    void testRenderPlanarTruss() {
        String text = writer.render(smallWarren(), ExportSettings.defaults());

        assertThat(text).startsWith("STAAD PLANE");
        assertThat(text).contains("UNIT FEET KIP");
        assertThat(text).contains("JOB NAME TOPOLOGY MODEL");
        assertThat(text).contains("2 5.0000 0.0000 0.0000;");
        assertThat(text).contains("4 2.5000 2.0000 0.0000;");
        assertThat(text).contains("MEMBER INCIDENCES");
        assertThat(text).contains("1 1 2;");
        assertThat(text).contains("4 1 4;");
        assertThat(text).contains("3 TABLE ST W12X26");
        assertThat(text).contains("1 2 TABLE ST W12X26");
        assertThat(text).contains("4 TO 7 TABLE ST L40404");
        assertThat(text).contains("SUPPORTS");
        assertThat(text).contains("1 3 PINNED");
        assertThat(text).doesNotContain("ELEMENT INCIDENCES");
        assertThat(text.trim()).endsWith("FINISH");
    }

    @Test
    void testZUpSwapsAxesAndUsesSpaceHeader() {
        ExportSettings settings = ExportSettings.builder()
                .axis(AxisConvention.Z_UP)
                .supportType(SupportType.FIXED)
                .units(UnitSystem.METER_KN)
                .build();

        String text = writer.render(smallWarren(), settings);

        assertThat(text).startsWith("STAAD SPACE");
        assertThat(text).contains("UNIT METER KN");
        assertThat(text).contains("4 2.5000 0.0000 2.0000;");
        assertThat(text).contains("1 3 FIXED");
    }

    @Test
    void testSectionOverrideAndSupportsOff() {
        ExportSettings settings = ExportSettings.builder()
                .section(MemberRole.DIAGONAL, "TABLE ST L50505")
                .emitSupports(false)
                .build();

        String text = writer.render(smallWarren(), settings);

        assertThat(text).contains("4 TO 7 TABLE ST L50505");
        assertThat(text).doesNotContain("SUPPORTS");
        assertThat(settings.sectionFor(MemberRole.CHORD_TOP)).isEqualTo("TABLE ST W12X26");
    }

    @Test
    void testRenderFrameRoles() {
        GenerationResult result = generator.generate(TopologyKind.GABLE_FRAME, warehouse());

        String text = writer.render(result, ExportSettings.defaults());

        assertThat(text).startsWith("STAAD SPACE");
        assertThat(text).contains("8 25.0000 28.0000 30.0000;");
        assertThat(text).contains("TABLE ST W14X90");
        assertThat(text).contains("TABLE ST W18X35");
        assertThat(text).contains("1 5 6 10 11 15 16 20 21 25 PINNED");
    }

    @Test
    void testRenderPlatesAsShellElements() {
        GenerationResult result = generator.generate(TopologyKind.PLATE_MESH, plates());

        String text = writer.render(result, ExportSettings.defaults());

        assertThat(text).doesNotContain("MEMBER INCIDENCES");
        assertThat(text).contains("ELEMENT INCIDENCES SHELL");
        assertThat(text).contains("1 1 2 7 6;");
        assertThat(text).contains("13 21 22 27 26;");
        assertThat(text).contains("1 TO 12 THICKNESS 0.5000");
        assertThat(text).contains("13 TO 20 THICKNESS 0.8000");
        assertThat(text).contains("1 TO 5 PINNED");
    }

    @Test
    void testPlateEdgeMembersShiftElementNumbers() {
        GenerationResult result = generator.generate(TopologyKind.PLATE_MESH, plates());
        ExportSettings settings = ExportSettings.builder().emitPlateEdgeMembers(true).build();

        String text = writer.render(result, settings);

        assertThat(text).contains("MEMBER INCIDENCES");
        assertThat(text).contains("1 TO 53 PRIS YD 0.1 ZD 0.1");
        assertThat(text).contains("54 1 2 7 6;");
        assertThat(text).contains("54 TO 65 THICKNESS 0.5000");
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path target = tempDir.resolve("out/models/warren.std");

        writer.write(smallWarren(), ExportSettings.defaults(), target);

        assertThat(Files.exists(target)).isTrue();
        assertThat(Files.readString(target)).isEqualTo(writer.render(smallWarren(), ExportSettings.defaults()));
    }

    @Test
    void testMaterialWrittenForAllMembers() {
        assertThat(writer.render(smallWarren(), ExportSettings.defaults())).contains("CONSTANTS\nMATERIAL STEEL ALL\n");

        GenerationResult grid = generator.generate(TopologyKind.BUILDING_GRID, grid(2, 2, 1));
        ExportSettings concrete = ExportSettings.builder().material(Material.CONCRETE).build();
        assertThat(writer.render(grid, concrete)).contains("MATERIAL CONCRETE ALL");
    }

    @Test
    void testLeftAndRightSupportOverrides() {
        ExportSettings settings = ExportSettings.builder()
                .leftSupport(SupportType.FIXED)
                .rightSupport(SupportType.PINNED)
                .build();

        String text = writer.render(smallWarren(), settings);

        assertThat(text).contains("SUPPORTS\n1 FIXED\n3 PINNED\n");
    }

    @Test
    void testGableFrameSupportSidesRunAcrossTheWidth() {
        GenerationResult result = generator.generate(TopologyKind.GABLE_FRAME, warehouse());
        ExportSettings settings = ExportSettings.builder().leftSupport(SupportType.FIXED).build();

        String text = writer.render(result, settings);

        // left bases sit at z = 0, right bases at z = width
        assertThat(text).contains("1 6 11 16 21 FIXED");
        assertThat(text).contains("5 10 15 20 25 PINNED");
    }

    @Test
    void testTrussLoadCasesAndCombinations() {
        ExportSettings settings = ExportSettings.builder()
                .loads(LoadSettings.builder()
                        .selfWeight(true)
                        .deadLoad(0.5)
                        .liveLoad(0.25)
                        .jointLiveLoad(10.0)
                        .windLoad(0.2)
                        .combinations(true)
                        .build())
                .performAnalysis(true)
                .build();

        String text = writer.render(smallWarren(), settings);

        assertThat(text).contains("LOAD 1 LOADTYPE Dead TITLE DEAD LOAD\n"
                + "SELFWEIGHT Y -1\n"
                + "MEMBER LOAD\n"
                + "1 2 UNI GY -0.5000\n"
                + "LOAD 2 LOADTYPE Live TITLE LIVE LOAD\n"
                + "MEMBER LOAD\n"
                + "1 2 UNI GY -0.2500\n"
                + "JOINT LOAD\n"
                + "2 FY -10.0000\n"
                // a Warren truss has no verticals, wind goes to the deck chord
                + "LOAD 3 LOADTYPE Wind TITLE WIND LOAD\n"
                + "MEMBER LOAD\n"
                + "1 2 UNI GX 0.2000\n"
                + "LOAD COMB 4 1.4 DL\n"
                + "1 1.4\n"
                + "LOAD COMB 5 1.2 DL + 1.6 LL\n"
                + "1 1.2 2 1.6\n"
                + "LOAD COMB 6 1.2 DL + 1.0 LL + 1.0 WL\n"
                + "1 1.2 2 1.0 3 1.0\n"
                + "PERFORM ANALYSIS\n"
                + "FINISH");
        assertThat(text.indexOf("SUPPORTS")).isLessThan(text.indexOf("LOAD 1 "));
    }

    @Test
    void testCombinationsNeedEveryReferencedCase() {
        ExportSettings settings = ExportSettings.builder()
                .loads(LoadSettings.builder().deadLoad(0.5).combinations(true).build())
                .build();

        String text = writer.render(smallWarren(), settings);

        assertThat(text).contains("LOAD COMB 2 1.4 DL\n1 1.4\n");
        assertThat(text).doesNotContain("LIVE LOAD", "1.6 LL", "WL");
    }

    @Test
    void testNoLoadsWritesNoLoadBlocks() {
        ExportSettings settings = ExportSettings.builder().performAnalysis(true).build();

        String text = writer.render(smallWarren(), settings);

        assertThat(text).doesNotContain("LOADTYPE", "LOAD COMB", "PERFORM ANALYSIS");
    }

    @Test
    void testZUpLoadsActAlongZ() {
        ExportSettings settings = ExportSettings.builder()
                .axis(AxisConvention.Z_UP)
                .loads(LoadSettings.builder().selfWeight(true).jointLiveLoad(10.0).build())
                .build();

        String text = writer.render(smallWarren(), settings);

        assertThat(text).contains("SELFWEIGHT Z -1");
        assertThat(text).contains("2 FZ -10.0000");
    }

    @Test
    void testFrameLoadsOnRaftersAndColumns() {
        GenerationResult result = generator.generate(TopologyKind.GABLE_FRAME, warehouse());
        ExportSettings settings = ExportSettings.builder()
                .loads(LoadSettings.builder().deadLoad(0.3).windLoad(0.2).build())
                .build();

        String text = writer.render(result, settings);

        // each station adds two columns, then its two rafters
        assertThat(text).contains("3 4 7 8 11 12 15 16 19 20 UNI GY -0.3000");
        assertThat(text).contains("1 2 5 6 9 10 13 14 17 18 UNI GZ 0.2000");
    }

    @Test
    void testPlateLoadsAsElementPressure() {
        GenerationResult result = generator.generate(TopologyKind.PLATE_MESH, plates());
        ExportSettings settings = ExportSettings.builder()
                .loads(LoadSettings.builder().deadLoad(0.1).windLoad(0.3).build())
                .build();

        String text = writer.render(result, settings);

        assertThat(text).doesNotContain("MEMBER LOAD");
        assertThat(text).contains("ELEMENT LOAD\n13 TO 20 PR GY -0.1000");
        assertThat(text).contains("ELEMENT LOAD\n1 TO 12 PR GX 0.3000");
    }

    @Test
    void testNegativeLoadRejected() {
        ExportSettings settings = ExportSettings.builder()
                .loads(LoadSettings.builder().windLoad(-1.0).build())
                .build();

        assertThatThrownBy(() -> writer.render(smallWarren(), settings))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("windLoad must be a finite number of at least 0. Got: -1.0");
    }

    @ParameterizedTest
    @ValueSource(strings = { "TRUSS;FINISH", "LINE ONE\nLINE TWO", "CARRIAGE\rRETURN" })
    void testTitleThatWouldBreakTheCommandRejected(String title) {
        ExportSettings settings = ExportSettings.builder().title(title).build();

        assertThatThrownBy(() -> writer.render(smallWarren(), settings))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Title must not contain line breaks or ';'");
    }

    @Test
    void testNegativeZeroPrintedAsZero() {
        assertThat(StructuralModelView.coordinate(-0.0)).isEqualTo("0.0000");
        assertThat(StructuralModelView.coordinate(-1.25)).isEqualTo("-1.2500");
    }
}
