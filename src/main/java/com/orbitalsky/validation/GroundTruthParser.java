package com.orbitalsky.validation;

import com.orbitalsky.model.DetectionMetadata;
import com.orbitalsky.model.Mask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Rasterizes box labels ({@code class x_center y_center width height}, normalized to [0,1]) into a filled
 * rectangle mask. Lines with fewer than five fields or non-numeric fields are skipped.
 */
public final class GroundTruthParser {
    private static final Logger logger = LoggerFactory.getLogger(GroundTruthParser.class);

    public static final String METHOD = "GroundTruth_BoundingBoxes";

    private GroundTruthParser() {
    }

    /** An absent label file gives an all-zero mask. */
    public static Mask parse(Path labelFile, int width, int height) throws IOException {
        if (labelFile == null || !Files.exists(labelFile)) {
            return parse(Collections.emptyList(), width, height);
        }
        return parse(Files.readAllLines(labelFile, StandardCharsets.UTF_8), width, height);
    }

    public static Mask parse(List<String> lines, int width, int height) {
        byte[][] px = new byte[height][width];
        int boxes = 0;
        for (String line : lines) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 5) continue;
            try {
                Integer.parseInt(parts[0]);
                double xc = Double.parseDouble(parts[1]);
                double yc = Double.parseDouble(parts[2]);
                double bw = Double.parseDouble(parts[3]);
                double bh = Double.parseDouble(parts[4]);

                int xcPx = (int) (xc * width), ycPx = (int) (yc * height);
                int wPx = (int) (bw * width), hPx = (int) (bh * height);
                int x1 = Math.max(0, xcPx - wPx / 2), y1 = Math.max(0, ycPx - hPx / 2);
                int x2 = Math.min(width, xcPx + wPx / 2), y2 = Math.min(height, ycPx + hPx / 2);
                for (int y = y1; y < y2; y++) {
                    for (int x = x1; x < x2; x++) px[y][x] = 1;
                }
                boxes++;
            } catch (NumberFormatException e) {
                logger.warn("Skipping malformed label line '{}'", line);
            }
        }
        return new Mask(px, DetectionMetadata.of(METHOD, Collections.emptyMap(), boxes));
    }
}
