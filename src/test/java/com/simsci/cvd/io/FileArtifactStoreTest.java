package com.simsci.cvd.io;

import com.simsci.cvd.model.Sex;
import com.simsci.cvd.model.Target;
import com.simsci.cvd.paf.DrawOutput;
import com.simsci.cvd.paf.JointPafRecord;
import com.simsci.cvd.paf.LocationArtifact;
import com.simsci.cvd.paf.PafRecord;
import com.simsci.cvd.paf.StratificationCell;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.*;

public class FileArtifactStoreTest {

    private static final Target IHD = Target.parse(
            "ischemic_heart_disease.susceptible_to_acute_myocardial_infarction.incidence_rate");
    private static final StratificationCell CELL = new StratificationCell(Sex.FEMALE, "60_plus");

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private FileArtifactStore store;

    @Before
    public void setUp() {
        store = new FileArtifactStore(tmp.getRoot().toPath(), "v1");
    }

    static DrawOutput draw(String version, String location, int draw) {
        double sbp = 0.1 + draw / 100.0, smoking = 0.05;
        return new DrawOutput(version, location, draw,
                List.of(new PafRecord("high_systolic_blood_pressure", IHD, CELL, draw, sbp),
                        new PafRecord("smoking", IHD, CELL, draw, smoking)),
                List.of(new JointPafRecord(IHD, CELL, draw, 1 - (1 - sbp) * (1 - smoking),
                        List.of("high_systolic_blood_pressure", "smoking"))));
    }

    @Test
    public void testWriteAndReadDraw() throws Exception {
        // 1. Execute
        store.writeDraw(draw("v1", "Alabama", 7));

        // 2. Verify
        Optional<DrawOutput> read = store.readDraw("Alabama", 7);
        assertTrue(read.isPresent());
        assertEquals(draw("v1", "Alabama", 7), read.get());
        assertEquals(Set.of(7), store.completedDraws("Alabama"));
        assertFalse(store.readDraw("Alabama", 8).isPresent());
        assertTrue(store.completedDraws("Alaska").isEmpty());

        // No temporary files left behind
        File[] files = store.locationDir("Alabama").toFile().listFiles();
        assertNotNull(files);
        assertEquals(1, files.length);
        assertEquals("draw_0007.json", files[0].getName());
    }

    @Test
    public void testRewriteReplacesDraw() throws Exception {
        store.writeDraw(draw("v1", "Alabama", 0));
        DrawOutput second = new DrawOutput("v1", "Alabama", 0, List.of(), List.of());
        store.writeDraw(second);
        assertEquals(second, store.readDraw("Alabama", 0).orElseThrow());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testVersionMismatchRejected() throws Exception {
        store.writeDraw(draw("v2", "Alabama", 0));
    }

    @Test
    public void testLocationNamesAreSanitized() throws Exception {
        store.writeDraw(draw("v1", "New York/Kings", 1));
        Path dir = store.locationDir("New York/Kings");
        assertEquals("New_York_Kings", dir.getFileName().toString());
        assertTrue(Files.exists(dir.resolve("draw_0001.json")));
        assertEquals(Set.of(1), store.completedDraws("New York/Kings"));
    }

    @Test
    public void testAssembleRequiresEveryDraw() throws Exception {
        // 1. Setup: draws 0 and 2 of 3
        store.writeDraw(draw("v1", "Alabama", 0));
        store.writeDraw(draw("v1", "Alabama", 2));

        // 2. Execute and verify
        try {
            store.assemble("Alabama", 3);
            fail("expected IllegalStateException");
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage().contains("[1]"));
        }
        assertFalse(store.readArtifact("Alabama").isPresent());
    }

    @Test
    public void testAssembleCompleteLocation() throws Exception {
        // 1. Setup
        for (int d = 0; d < 3; d++)
            store.writeDraw(draw("v1", "Alabama", d));

        // 2. Execute
        LocationArtifact artifact = store.assemble("Alabama", 3);

        // 3. Verify
        assertEquals(3, artifact.drawCount());
        assertEquals(3, artifact.values().size());
        assertEquals(3, artifact.pafKeyCount());
        String sbpKey = "risk_factor.high_systolic_blood_pressure.population_attributable_fraction:" + IHD
                + ":female.60_plus";
        assertArrayEquals(new double[] { 0.10, 0.11, 0.12 }, artifact.values().get(sbpKey), 1e-12);
        assertEquals(3, store.drawCount("Alabama", sbpKey));
        assertEquals(0, store.drawCount("Alabama", "missing"));

        LocationArtifact read = store.readArtifact("Alabama").orElseThrow();
        assertEquals(artifact.values().keySet(), read.values().keySet());
        assertArrayEquals(artifact.values().get(sbpKey), read.values().get(sbpKey), 0.0);
    }

    @Test
    public void testAssembleRejectsKeyMissingFromADraw() throws Exception {
        store.writeDraw(draw("v1", "Alabama", 0));
        store.writeDraw(new DrawOutput("v1", "Alabama", 1, List.of(), List.of()));
        try {
            store.assemble("Alabama", 2);
            fail("expected IllegalStateException");
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage().contains("draw 1"));
        }
    }
}
