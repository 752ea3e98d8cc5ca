package com.orbitalsky.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Root of the pipeline YAML file:
 * <pre>
 * detection:
 *   detector: BASELINE
 *   thresholdSigma: 4.5
 * odc:
 *   bootstrapSamples: 200
 * calibration:
 *   darkSkyMagnitude: 21.8
 * threads: 4
 * </pre>
 */
public class PipelineConfig {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    private DetectionConfig detection = new DetectionConfig();
    private OdcConfig odc = new OdcConfig();
    private CalibrationConfig calibration = new CalibrationConfig();
    private int threads = Runtime.getRuntime().availableProcessors();

    public DetectionConfig getDetection() {
        return detection;
    }

    public void setDetection(DetectionConfig detection) {
        this.detection = (detection == null) ? new DetectionConfig() : detection;
    }

    public OdcConfig getOdc() {
        return odc;
    }

    public void setOdc(OdcConfig odc) {
        this.odc = (odc == null) ? new OdcConfig() : odc;
    }

    public CalibrationConfig getCalibration() {
        return calibration;
    }

    public void setCalibration(CalibrationConfig calibration) {
        this.calibration = (calibration == null) ? new CalibrationConfig() : calibration;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = Math.max(1, threads);
    }

    /**
     * @throws IllegalArgumentException if the YAML holds values the detectors or the ODC estimator cannot run with
     */
    public static PipelineConfig parse(String yaml) {
        PipelineConfig config = new Yaml(new Constructor(PipelineConfig.class, new LoaderOptions())).load(yaml);
        return (config == null) ? new PipelineConfig() : config.validate();
    }

    /**
     * Checks the values a hand-edited file can get wrong; a null detector falls back to ADAPTIVE.
     *
     * @return this config
     * @throws IllegalArgumentException naming the first offending key
     */
    public PipelineConfig validate() {
        DetectionConfig d = detection;
        if (d.getDetector() == null) d.setDetector(DetectorType.ADAPTIVE);
        require(d.getThresholdSigma() >= 0, "detection.thresholdSigma must be non-negative");
        require(d.getLineHalfWidth() > 0, "detection.lineHalfWidth must be positive");
        require(d.getImprovedLineHalfWidth() > 0, "detection.improvedLineHalfWidth must be positive");
        require(d.getMinStreakLength() >= 0, "detection.minStreakLength must be non-negative");
        require(d.getMinAspectRatio() > 0, "detection.minAspectRatio must be positive");
        require(d.getPercentile() >= 0 && d.getPercentile() <= 100, "detection.percentile must be in [0, 100]");
        require(d.getMinRegionArea() >= 0, "detection.minRegionArea must be non-negative");
        require(odc.getBootstrapSamples() >= 0, "odc.bootstrapSamples must be non-negative");
        require(odc.getExtinction() >= 0, "odc.extinction must be non-negative");
        return this;
    }

    private static void require(boolean ok, String message) {
        if (!ok) throw new IllegalArgumentException(message);
    }

    /**
     * Loads a YAML file, or returns the defaults when {@code path} is null or does not exist.
     */
    public static PipelineConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            logger.info("No pipeline config found, using defaults");
            return new PipelineConfig();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            PipelineConfig config = new Yaml(new Constructor(PipelineConfig.class, new LoaderOptions())).load(reader);
            logger.info("Loaded pipeline config from {}", path);
            return (config == null) ? new PipelineConfig() : config.validate();
        }
    }
}
