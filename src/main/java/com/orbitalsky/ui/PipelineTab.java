package com.orbitalsky.ui;

import com.orbitalsky.config.DetectorType;
import com.orbitalsky.config.PipelineConfig;
import com.orbitalsky.model.AppConfig;
import com.orbitalsky.model.BatchReport;
import com.orbitalsky.model.FrameOutcome;
import com.orbitalsky.model.NightReport;
import com.orbitalsky.model.OdcResult;
import com.orbitalsky.service.StreakPipelineService;
import javafx.application.Platform;
import javafx.concurrent.Task;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.DirectoryChooser;
import javafx.stage.FileChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.Map;

public class PipelineTab {
    private static final Logger logger = LoggerFactory.getLogger(PipelineTab.class);

    private Task<BatchReport> currentTask;
    private StreakPipelineService currentService;

    private TextField txtInput, txtOutput, txtConfig;
    private ComboBox<DetectorType> cmbDetector;
    private TextArea logArea;
    private ProgressBar progressBar;
    private Button btnStart, btnStop;

    private Label valFrames, valAffected, valMedianArea, valP95Area;
    private Label valOdc, valOdcCi, valOdcMethod, valBaseline;

    public Tab create() {
        Tab tab = new Tab("🛰️ Pipeline");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(15));

        VBox topContainer = new VBox(10);

        txtInput = new TextField(AppConfig.getInputDir());
        txtInput.setPromptText("Carpeta de frames FITS...");
        txtInput.setPrefWidth(350);
        txtOutput = new TextField(AppConfig.getOutputDir());
        txtOutput.setPromptText("Carpeta de resultados...");
        txtOutput.setPrefWidth(350);
        txtConfig = new TextField(AppConfig.getConfigPath());
        txtConfig.setPromptText("pipeline.yaml (opcional)");
        txtConfig.setPrefWidth(350);

        Button btnIn = new Button("📂 Seleccionar");
        btnIn.setOnAction(e -> browseDir(txtInput));
        Button btnOut = new Button("📂 Seleccionar");
        btnOut.setOnAction(e -> browseDir(txtOutput));
        Button btnCfg = new Button("📄 YAML");
        btnCfg.setOnAction(e -> browseFile(txtConfig));

        GridPane folders = new GridPane();
        folders.setHgap(10); folders.setVgap(8);
        folders.addRow(0, new Label("Frames FITS:"), txtInput, btnIn);
        folders.addRow(1, new Label("Salida:"), txtOutput, btnOut);
        folders.addRow(2, new Label("Configuración:"), txtConfig, btnCfg);

        cmbDetector = new ComboBox<>();
        cmbDetector.getItems().addAll(DetectorType.values());
        cmbDetector.setValue(DetectorType.parse(AppConfig.getDetector()));

        btnStart = new Button("▶ PROCESAR NOCHE");
        btnStart.setStyle("-fx-base: #2196F3; -fx-text-fill: white; -fx-font-weight: bold;");
        btnStart.setOnAction(e -> startProcessing());
        btnStop = new Button("⏹ DETENER");
        btnStop.setDisable(true);
        btnStop.setOnAction(e -> stopProcessing());

        HBox actions = new HBox(10, new Label("Detector:"), cmbDetector, btnStart, btnStop);
        actions.setAlignment(Pos.CENTER_LEFT);

        progressBar = new ProgressBar(0);
        progressBar.setMaxWidth(Double.MAX_VALUE);

        topContainer.getChildren().addAll(folders, actions, progressBar);

        // RESUMEN
        GridPane statsGrid = new GridPane();
        statsGrid.setHgap(20); statsGrid.setVgap(15);
        statsGrid.setPadding(new Insets(15));
        statsGrid.setStyle("-fx-border-color: #DDD; -fx-border-radius: 8; -fx-background-color: #FAFAFA;");
        statsGrid.setAlignment(Pos.CENTER);
        valFrames = createStatCard(statsGrid, "Frames", 0, 0);
        valAffected = createStatCard(statsGrid, "Con trazas", 1, 0);
        valMedianArea = createStatCard(statsGrid, "Área mediana", 2, 0);
        valP95Area = createStatCard(statsGrid, "Área p95", 3, 0);
        valOdc = createStatCard(statsGrid, "ODC (%)", 0, 1);
        valOdcCi = createStatCard(statsGrid, "IC 95%", 1, 1);
        valBaseline = createStatCard(statsGrid, "Fondo base", 2, 1);
        valOdcMethod = createStatCard(statsGrid, "Método", 3, 1);

        logArea = new TextArea();
        logArea.setEditable(false);
        logArea.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        VBox center = new VBox(15, statsGrid, logArea);
        center.setPadding(new Insets(15, 0, 0, 0));
        VBox.setVgrow(logArea, Priority.ALWAYS);

        root.setTop(topContainer);
        root.setCenter(center);
        tab.setContent(root);
        return tab;
    }

    private Label createStatCard(GridPane grid, String title, int col, int row) {
        VBox box = new VBox(5, new Label(title), new Label("--"));
        box.setAlignment(Pos.CENTER); box.setPrefWidth(130);
        ((Label) box.getChildren().get(0)).setStyle("-fx-text-fill: #666; -fx-font-size: 10px;");
        ((Label) box.getChildren().get(1)).setFont(Font.font("System", FontWeight.BOLD, 16));
        grid.add(box, col, row);
        return (Label) box.getChildren().get(1);
    }

    private void browseDir(TextField tf) {
        DirectoryChooser dc = new DirectoryChooser();
        File f = dc.showDialog(tf.getScene().getWindow());
        if (f != null) tf.setText(f.getAbsolutePath());
    }

    private void browseFile(TextField tf) {
        FileChooser fc = new FileChooser();
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("YAML", "*.yaml", "*.yml"));
        File f = fc.showOpenDialog(tf.getScene().getWindow());
        if (f != null) tf.setText(f.getAbsolutePath());
    }

    private void startProcessing() {
        File in = new File(txtInput.getText().trim());
        if (!in.isDirectory()) {
            logArea.appendText("❌ Carpeta de frames inválida.\n");
            return;
        }
        File out = txtOutput.getText().isBlank() ? new File(in, "results") : new File(txtOutput.getText().trim());

        AppConfig.setInputDir(in.getAbsolutePath());
        AppConfig.setOutputDir(out.getAbsolutePath());
        AppConfig.setConfigPath(txtConfig.getText().trim());
        AppConfig.setDetector(cmbDetector.getValue().name());

        PipelineConfig config;
        try {
            config = PipelineConfig.load(txtConfig.getText().isBlank() ? null : Path.of(txtConfig.getText().trim()));
        } catch (Exception e) {
            logger.error("Cannot load configuration", e);
            logArea.appendText("❌ Configuración inválida: " + e.getMessage() + "\n");
            return;
        }
        config.getDetection().setDetector(cmbDetector.getValue());
        currentService = new StreakPipelineService(config);

        btnStart.setDisable(true); btnStop.setDisable(false);
        logArea.appendText("🔬 Analizando " + in.getName() + " con " + currentService.getDetector().name() + "...\n");

        currentTask = new Task<>() {
            @Override protected BatchReport call() throws Exception {
                return currentService.run(in, out, (done, total, outcome) -> {
                    updateProgress(done, total);
                    Platform.runLater(() -> logArea.appendText(describe(outcome) + "\n"));
                });
            }
        };
        progressBar.progressProperty().bind(currentTask.progressProperty());
        currentTask.setOnSucceeded(e -> {
            showSummary(currentTask.getValue());
            logArea.appendText("🏁 FIN. Resultados en " + out.getAbsolutePath() + "\n");
            resetButtons();
        });
        currentTask.setOnFailed(e -> {
            Throwable t = currentTask.getException();
            logger.error("Pipeline failed", t);
            logArea.appendText("❌ Error: " + t.getMessage() + "\n");
            resetButtons();
        });
        currentTask.setOnCancelled(e -> resetButtons());
        new Thread(currentTask).start();
    }

    private void stopProcessing() {
        if (currentService != null) currentService.cancel();
        logArea.appendText("⏹ Deteniendo, los frames en curso terminan...\n");
        btnStop.setDisable(true);
    }

    private void resetButtons() {
        btnStart.setDisable(false);
        btnStop.setDisable(true);
    }

    private static String describe(FrameOutcome o) {
        switch (o.status) {
            case SKIPPED:
                return o.file + " -> ⏭ OMITIDO (" + o.reason + ")";
            case DEGRADED:
                return o.file + " -> ⚠️ DEGRADADO (" + o.reason + ")";
            default:
                return String.format("%s -> ✅ %d trazas | área %.4f | severidad %.2f",
                        o.file, o.quality.numStreaks, o.quality.streakAreaFraction, o.quality.severityScore);
        }
    }

    private void showSummary(BatchReport report) {
        NightReport n = report.night;
        OdcResult odc = report.odc;
        valFrames.setText(String.valueOf(n.nFrames));
        valAffected.setText(String.valueOf(n.affectedFrames));
        valMedianArea.setText(String.format("%.4f", n.medianStreakAreaFraction));
        valP95Area.setText(String.format("%.4f", n.p95StreakAreaFraction));
        if (odc.hasData()) {
            valOdc.setText(String.format("%.2f", odc.odcPercent));
            valOdcCi.setText(String.format("%.1f .. %.1f", odc.odcCi95[0], odc.odcCi95[1]));
            valBaseline.setText(String.format("%.1f", odc.baselineLevel));
            valOdcMethod.setText(odc.method == null ? "-" : odc.method.tag());
        } else {
            valOdc.setText("sin datos");
            valOdcCi.setText("--");
            valBaseline.setText("--");
            valOdcMethod.setText("-");
        }
        StringBuilder sb = new StringBuilder("📊 Severidad: ");
        for (Map.Entry<String, Integer> e : n.severityHistogram.entrySet()) {
            sb.append(e.getKey()).append('=').append(e.getValue()).append("  ");
        }
        logArea.appendText(sb.toString().trim() + "\n");
        if (odc.fallbackReason != null) logArea.appendText("⚠️ Modelo físico no disponible: " + odc.fallbackReason + "\n");
    }
}
