package com.orbitalsky.validation;

import com.orbitalsky.model.Mask;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class GroundTruthParserTest {

    @Test
    void centredBoxCoversExpectedPixels() {
        Mask gt = GroundTruthParser.parse(Collections.singletonList("0 0.5 0.5 0.1 0.1"), 100, 100);

        assertEquals(100, gt.contaminatedCount());
        assertTrue(gt.isContaminated(45, 45));
        assertTrue(gt.isContaminated(54, 54));
        assertFalse(gt.isContaminated(55, 55));
        assertFalse(gt.isContaminated(44, 50));
        assertEquals(1, gt.meta.detectedLines);
        assertEquals(GroundTruthParser.METHOD, gt.meta.method);
    }

    @Test
    void boxesAreClippedToTheFrame() {
        Mask gt = GroundTruthParser.parse(Collections.singletonList("0 0.0 0.0 0.2 0.2"), 50, 50);

        assertEquals(25, gt.contaminatedCount());
        assertTrue(gt.isContaminated(0, 0));
    }

    @Test
    void malformedAndShortLinesAreSkipped() {
        Mask gt = GroundTruthParser.parse(Arrays.asList("", "0 0.5 0.5", "0 x 0.5 0.1 0.1", "0 0.5 0.5 0.1 0.1"), 100, 100);

        assertEquals(1, gt.meta.detectedLines);
        assertEquals(100, gt.contaminatedCount());
    }

    @Test
    void missingLabelFileGivesEmptyMask(@TempDir Path dir) throws IOException {
        Mask gt = GroundTruthParser.parse(dir.resolve("missing.txt"), 30, 20);

        assertEquals(0, gt.contaminatedCount());
        assertEquals(30, gt.width());
        assertEquals(20, gt.height());
        assertEquals(0, gt.meta.detectedLines);
    }

    @Test
    void readsLabelFile(@TempDir Path dir) throws IOException {
        Path label = dir.resolve("img.txt");
        Files.write(label, Arrays.asList("0 0.25 0.5 0.1 0.1", "0 0.75 0.5 0.1 0.1"));

        Mask gt = GroundTruthParser.parse(label, 100, 100);

        assertEquals(200, gt.contaminatedCount());
        assertEquals(2, gt.meta.detectedLines);
    }
}
