package com.orbitalsky.service;

import com.orbitalsky.model.DetectionMetadata;
import com.orbitalsky.model.Frame;
import com.orbitalsky.model.Mask;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FitsFrameServiceTest {

    private final FitsFrameService service = new FitsFrameService();

    @Test
    void readsFloatImageAndHeader(@TempDir Path dir) throws Exception {
        Map<String, Object> cards = new LinkedHashMap<>();
        cards.put("DATE-OBS", "2024-03-10T03:00:00");
        cards.put("EXPTIME", 30.0);
        float[][] data = FitsTestFiles.flat(16, 8, 250f);
        data[2][5] = 999f;
        File f = FitsTestFiles.write(dir.resolve("a.fits").toFile(), data, cards);

        Frame frame = service.read(f);

        assertEquals(16, frame.width());
        assertEquals(8, frame.height());
        assertEquals(999.0, frame.data[2][5], 1e-6);
        assertEquals(250.0, frame.data[0][0], 1e-6);
        assertEquals("2024-03-10T03:00:00", frame.timestampUtc);
        assertEquals(30.0, Double.parseDouble(frame.header.get("EXPTIME")), 1e-9);
        assertEquals("a.fits", frame.fileName());
    }

    @Test
    void appliesBzeroToUnsignedShorts(@TempDir Path dir) throws Exception {
        short[][] raw = {{(short) -32768, 0}, {(short) 32767, (short) -32767}};
        File f = FitsTestFiles.write(dir.resolve("u16.fits").toFile(), raw, Collections.singletonMap("BZERO", 32768.0));

        Frame frame = service.read(f);

        assertEquals(0.0, frame.data[0][0], 0.0);
        assertEquals(32768.0, frame.data[0][1], 0.0);
        assertEquals(65535.0, frame.data[1][0], 0.0);
        assertEquals(1.0, frame.data[1][1], 0.0);
        assertNull(frame.timestampUtc);
    }

    @Test
    void fallsBackToDateKeyword(@TempDir Path dir) throws Exception {
        File f = FitsTestFiles.write(dir.resolve("d.fits").toFile(), new int[][]{{1, 2}, {3, 4}},
                Collections.singletonMap("DATE", "2024-01-01T00:00:00"));

        Frame frame = service.read(f);

        assertEquals("2024-01-01T00:00:00", frame.timestampUtc);
        assertEquals(4.0, frame.data[1][1], 0.0);
    }

    @Test
    void missingFileIsNotFound(@TempDir Path dir) {
        assertThrows(FileNotFoundException.class, () -> service.read(dir.resolve("none.fits").toFile()));
    }

    @Test
    void garbageFileIsAnIoError(@TempDir Path dir) throws IOException {
        Path p = dir.resolve("junk.fits");
        Files.write(p, "this is not a FITS file".getBytes());

        assertThrows(IOException.class, () -> service.read(p.toFile()));
    }

    @Test
    void writtenMaskKeepsSourceHeader(@TempDir Path dir) throws Exception {
        Mask mask = Mask.empty(6, 4, DetectionMetadata.of("test", Collections.emptyMap(), 1));
        mask.pixels[1][2] = 1;
        mask.pixels[3][5] = 1;
        Map<String, String> header = new LinkedHashMap<>();
        header.put("SIMPLE", "T");
        header.put("NAXIS1", "6");
        header.put("OBSERVER", "Night shift");
        header.put("EXPTIME", "30.0");
        header.put("VERYLONGKEYWORD", "dropped");
        File out = dir.resolve("masks").resolve("a_mask.fits").toFile();

        service.writeMask(out, mask, header);
        Frame back = service.read(out);

        assertTrue(out.isFile());
        assertEquals(6, back.width());
        assertEquals(4, back.height());
        assertEquals(1.0, back.data[1][2], 0.0);
        assertEquals(1.0, back.data[3][5], 0.0);
        assertEquals(0.0, back.data[0][0], 0.0);
        assertEquals("T", back.header.get(FitsFrameService.MASK_KEYWORD));
        assertEquals("Night shift", back.header.get("OBSERVER"));
        assertEquals(30.0, Double.parseDouble(back.header.get("EXPTIME")), 1e-9);
        assertFalse(back.header.containsKey("VERYLONGKEYWORD"));
    }

    @Test
    void overwritesExistingMask(@TempDir Path dir) throws Exception {
        File out = dir.resolve("m.fits").toFile();
        Mask first = Mask.empty(4, 4, DetectionMetadata.of("test", Collections.emptyMap(), 0));
        Mask second = Mask.empty(4, 4, DetectionMetadata.of("test", Collections.emptyMap(), 0));
        second.pixels[0][0] = 1;

        service.writeMask(out, first, null);
        service.writeMask(out, second, null);

        assertEquals(1.0, service.read(out).data[0][0], 0.0);
    }
}
