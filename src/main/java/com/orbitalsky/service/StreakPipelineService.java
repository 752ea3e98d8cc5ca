package com.orbitalsky.service;

import com.orbitalsky.config.PipelineConfig;
import com.orbitalsky.detection.StreakDetector;
import com.orbitalsky.metrics.FrameQualityService;
import com.orbitalsky.metrics.NightAggregator;
import com.orbitalsky.model.BatchReport;
import com.orbitalsky.model.Frame;
import com.orbitalsky.model.FrameOutcome;
import com.orbitalsky.model.FrameQuality;
import com.orbitalsky.model.Mask;
import com.orbitalsky.model.NightReport;
import com.orbitalsky.model.OdcResult;
import com.orbitalsky.skyglow.OdcEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Night batch: every FITS frame of a folder goes through detection and frame quality on a fixed pool,
 * then the night report and the ODC estimate are computed over the frames that made it.
 * <p>
 * Output layout under the output folder:
 * <pre>
 * masks/&lt;name&gt;_mask.fits
 * quality/&lt;name&gt;_quality.json
 * night_summary.json
 * odc_report.json
 * </pre>
 */
public class StreakPipelineService {
    private static final Logger logger = LoggerFactory.getLogger(StreakPipelineService.class);

    public interface ProgressListener {
        void onFrame(int done, int total, FrameOutcome outcome);
    }

    private final PipelineConfig config;
    private final StreakDetector detector;
    private final OdcEstimator odcEstimator;
    private final FitsFrameService fitsService = new FitsFrameService();
    private final FrameQualityService qualityService = new FrameQualityService();
    private final NightAggregator aggregator = new NightAggregator();
    private final ReportWriter writer = new ReportWriter();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public StreakPipelineService(PipelineConfig config) {
        this(config, config.getDetection().createDetector(),
                new OdcEstimator(config.getOdc(), config.getCalibration()));
    }

    public StreakPipelineService(PipelineConfig config, StreakDetector detector, OdcEstimator odcEstimator) {
        this.config = config;
        this.detector = detector;
        this.odcEstimator = odcEstimator;
    }

    public StreakDetector getDetector() {
        return detector;
    }

    /** FITS files of {@code dir} sorted by name, leaving out truth images and previously written masks. */
    public static List<File> listFrames(File dir) {
        File[] files = dir.listFiles((d, name) -> {
            String n = name.toLowerCase();
            boolean fits = n.endsWith(".fits") || n.endsWith(".fit") || n.endsWith(".fts");
            return fits && !n.contains("_truth") && !n.contains("mask");
        });
        if (files == null) return new ArrayList<>();
        Arrays.sort(files, Comparator.comparing(File::getName));
        return new ArrayList<>(Arrays.asList(files));
    }

    public BatchReport run(File inputDir, File outputDir) throws IOException, InterruptedException {
        return run(inputDir, outputDir, null);
    }

    public BatchReport run(File inputDir, File outputDir, ProgressListener listener)
            throws IOException, InterruptedException {
        if (!inputDir.isDirectory()) throw new IOException("Input folder not found: " + inputDir);
        String datasetId = inputDir.getName();
        List<File> files = listFrames(inputDir);
        logger.info("Processing {} frames from {} with {} ({} threads)",
                files.size(), inputDir, detector.name(), config.getThreads());

        cancelled.set(false);
        ExecutorService exec = Executors.newFixedThreadPool(config.getThreads());
        AtomicInteger done = new AtomicInteger(0);
        List<Future<FrameResult>> futures = new ArrayList<>();
        try {
            for (File f : files) {
                futures.add(exec.submit(() -> {
                    FrameResult r = processFile(f, outputDir);
                    if (listener != null) listener.onFrame(done.incrementAndGet(), files.size(), r.outcome);
                    return r;
                }));
            }
            exec.shutdown();

            List<FrameResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.error("Unexpected failure on {}", files.get(i).getName(), e.getCause());
                    results.add(FrameResult.skipped(files.get(i).getName(), String.valueOf(e.getCause())));
                }
            }
            BatchReport report = summarize(datasetId, results);
            if (outputDir != null) {
                writer.write(outputDir.toPath().resolve("night_summary.json"), report.night);
                writer.write(outputDir.toPath().resolve("odc_report.json"), report.odc);
            }
            logger.info("Batch {}: {} ok, {} degraded, {} skipped", datasetId,
                    report.count(FrameOutcome.Status.SUCCESS), report.count(FrameOutcome.Status.DEGRADED),
                    report.count(FrameOutcome.Status.SKIPPED));
            return report;
        } finally {
            exec.shutdownNow();
        }
    }

    /** Same pipeline over frames already in memory; nothing is written. */
    public BatchReport process(List<Frame> frames, String datasetId) {
        List<FrameResult> results = new ArrayList<>();
        for (Frame frame : frames) results.add(analyze(frame));
        return summarize(datasetId, results);
    }

    /** Frames not started yet come back as SKIPPED ("cancelled"); frames in progress finish. */
    public void cancel() {
        cancelled.set(true);
    }

    private FrameResult processFile(File f, File outputDir) {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            return FrameResult.skipped(f.getName(), "cancelled");
        }
        Frame frame;
        try {
            frame = fitsService.read(f);
        } catch (IOException e) {
            logger.warn("Skipping {}: {}", f.getName(), e.getMessage());
            return FrameResult.skipped(f.getName(), e.getMessage());
        }

        FrameResult r;
        try {
            r = analyze(frame);
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping {}: {}", f.getName(), e.getMessage());
            return FrameResult.skipped(f.getName(), e.getMessage());
        }

        if (outputDir != null) {
            String stem = stem(f.getName());
            try {
                fitsService.writeMask(outputDir.toPath().resolve("masks").resolve(stem + "_mask.fits").toFile(),
                        r.mask, frame.header);
                writer.write(outputDir.toPath().resolve("quality").resolve(stem + "_quality.json"), r.outcome.quality);
            } catch (IOException e) {
                logger.error("Cannot write outputs for {}: {}", f.getName(), e.getMessage());
            }
        }
        return r;
    }

    private FrameResult analyze(Frame frame) {
        Mask mask = detector.detect(frame.data);
        FrameQuality quality = qualityService.compute(frame, mask);
        FrameOutcome outcome = FrameOutcome.processed(quality);
        if (outcome.status == FrameOutcome.Status.DEGRADED) {
            logger.warn("{}: detector degraded ({})", frame.fileName(), mask.meta.failureReason);
        } else {
            logger.debug("{}: {} streaks, area {}", frame.fileName(), quality.numStreaks, quality.streakAreaFraction);
        }
        return new FrameResult(outcome, frame, mask);
    }

    private BatchReport summarize(String datasetId, List<FrameResult> results) {
        List<FrameOutcome> outcomes = new ArrayList<>();
        List<FrameQuality> qualities = new ArrayList<>();
        List<Frame> frames = new ArrayList<>();
        List<Mask> masks = new ArrayList<>();
        for (FrameResult r : results) {
            outcomes.add(r.outcome);
            if (r.frame == null) continue;
            qualities.add(r.outcome.quality);
            frames.add(r.frame);
            masks.add(r.mask);
        }
        NightReport night = aggregator.aggregate(qualities, datasetId);
        OdcResult odc = odcEstimator.estimate(frames, masks).withDatasetId(datasetId);
        return new BatchReport(datasetId, outcomes, night, odc);
    }

    static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static class FrameResult {
        final FrameOutcome outcome;
        final Frame frame;
        final Mask mask;

        FrameResult(FrameOutcome outcome, Frame frame, Mask mask) {
            this.outcome = outcome;
            this.frame = frame;
            this.mask = mask;
        }

        static FrameResult skipped(String file, String reason) {
            return new FrameResult(FrameOutcome.skipped(file, reason), null, null);
        }
    }
}
