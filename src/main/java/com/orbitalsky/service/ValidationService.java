package com.orbitalsky.service;

import com.orbitalsky.detection.StreakDetector;
import com.orbitalsky.model.DetectionMetrics;
import com.orbitalsky.model.Frame;
import com.orbitalsky.model.Mask;
import com.orbitalsky.model.ValidationReport;
import com.orbitalsky.model.ValidationSummary;
import com.orbitalsky.validation.DetectionEvaluator;
import com.orbitalsky.validation.GroundTruthParser;
import ij.IJ;
import ij.ImagePlus;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Runs a detector over a labeled dataset: {@code <dataset>/images} with box labels in
 * {@code <dataset>/labels/<stem>.txt}. A dataset without an {@code images} folder is read flat, labels still
 * in {@code labels/}. FITS frames go through {@link FitsFrameService}; PNG, JPEG and TIFF through ImageJ.
 */
public class ValidationService {
    private static final Logger logger = LoggerFactory.getLogger(ValidationService.class);

    private final StreakDetector detector;
    private final FitsFrameService fitsService = new FitsFrameService();
    private final ReportWriter writer = new ReportWriter();

    public ValidationService(StreakDetector detector) {
        this.detector = detector;
    }

    public ValidationReport validate(File datasetDir) throws IOException {
        return validate(datasetDir, 0);
    }

    /** @param maxSamples 0 para todo el dataset */
    public ValidationReport validate(File datasetDir, int maxSamples) throws IOException {
        File imagesDir = new File(datasetDir, "images");
        if (!imagesDir.isDirectory()) imagesDir = datasetDir;
        File labelsDir = new File(datasetDir, "labels");
        if (!imagesDir.isDirectory()) throw new IOException("Dataset folder not found: " + datasetDir);
        if (!labelsDir.isDirectory()) logger.warn("No labels folder in {}, every frame counts as streak-free", datasetDir);

        List<File> images = listImages(imagesDir);
        if (maxSamples > 0 && images.size() > maxSamples) images = images.subList(0, maxSamples);
        logger.info("Validating {} on {} images from {}", detector.name(), images.size(), datasetDir);

        List<DetectionMetrics> perFrame = new ArrayList<>();
        int failed = 0;
        for (File img : images) {
            try {
                double[][] data = readImage(img);
                int h = data.length, w = h == 0 ? 0 : data[0].length;
                Path label = labelsDir.toPath().resolve(StreakPipelineService.stem(img.getName()) + ".txt");
                Mask gt = GroundTruthParser.parse(label, w, h);
                Mask pred = detector.detect(data);
                perFrame.add(DetectionEvaluator.evaluateFrame(pred, gt));
            } catch (IOException | IllegalArgumentException e) {
                failed++;
                logger.warn("Skipping {}: {}", img.getName(), e.getMessage());
            }
        }

        ValidationSummary summary = DetectionEvaluator.aggregate(perFrame);
        logger.info("Validation done: {} frames, {} failed, mean IoU {}, F1 {}", perFrame.size(), failed,
                String.format("%.3f", summary.meanIou), String.format("%.3f", summary.globalF1));
        return new ValidationReport(detector.name(), datasetDir.getName(), summary, perFrame);
    }

    public ValidationReport validateAndWrite(File datasetDir, File reportFile, int maxSamples) throws IOException {
        ValidationReport report = validate(datasetDir, maxSamples);
        writer.write(reportFile.toPath(), report);
        return report;
    }

    static List<File> listImages(File dir) {
        File[] files = dir.listFiles((d, name) -> isSupported(name.toLowerCase()));
        if (files == null) return new ArrayList<>();
        Arrays.sort(files, Comparator.comparing(File::getName));
        return new ArrayList<>(Arrays.asList(files));
    }

    private static boolean isSupported(String n) {
        return n.endsWith(".fits") || n.endsWith(".fit") || n.endsWith(".fts")
                || n.endsWith(".png") || n.endsWith(".jpg") || n.endsWith(".jpeg")
                || n.endsWith(".tif") || n.endsWith(".tiff");
    }

    private double[][] readImage(File f) throws IOException {
        String n = f.getName().toLowerCase();
        if (n.endsWith(".fits") || n.endsWith(".fit") || n.endsWith(".fts")) {
            Frame frame = fitsService.read(f);
            return frame.data;
        }
        ImagePlus imp = IJ.openImage(f.getAbsolutePath());
        if (imp == null) throw new IOException("ImageJ cannot open " + f.getName());
        try {
            FloatProcessor fp = imp.getProcessor().convertToFloatProcessor();
            int w = fp.getWidth(), h = fp.getHeight();
            double[][] d = new double[h][w];
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) d[y][x] = fp.getf(x, y);
            return d;
        } finally {
            imp.close();
        }
    }
}
