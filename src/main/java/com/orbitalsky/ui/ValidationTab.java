package com.orbitalsky.ui;

import com.orbitalsky.config.DetectorType;
import com.orbitalsky.config.PipelineConfig;
import com.orbitalsky.model.AppConfig;
import com.orbitalsky.model.ValidationReport;
import com.orbitalsky.model.ValidationSummary;
import com.orbitalsky.service.ValidationService;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.DirectoryChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;

public class ValidationTab {
    private static final Logger logger = LoggerFactory.getLogger(ValidationTab.class);

    private TextField txtDataset, txtMaxSamples;
    private ComboBox<DetectorType> cmbDetector;
    private Label lblStatus;
    private Label valIou, valPrecision, valRecall, valF1, valGlobalF1, valFrames;
    private TextArea txtReport;

    public Tab create() {
        Tab tab = new Tab("🎯 Validación");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        // HEADER
        VBox header = new VBox(10);
        header.setAlignment(Pos.CENTER);
        Label title = new Label("Validación contra etiquetas");
        title.setFont(Font.font("System", FontWeight.BOLD, 18));

        txtDataset = new TextField(AppConfig.getValidationDir());
        txtDataset.setPromptText("Dataset con images/ y labels/");
        txtDataset.setPrefWidth(350);
        Button btnBrowse = new Button("📂 Seleccionar");
        btnBrowse.setOnAction(e -> {
            DirectoryChooser dc = new DirectoryChooser();
            File f = dc.showDialog(root.getScene().getWindow());
            if (f != null) txtDataset.setText(f.getAbsolutePath());
        });
        cmbDetector = new ComboBox<>();
        cmbDetector.getItems().addAll(DetectorType.values());
        cmbDetector.setValue(DetectorType.parse(AppConfig.getDetector()));
        txtMaxSamples = new TextField("0");
        txtMaxSamples.setPrefWidth(60);

        Button btnRun = new Button("▶ VALIDAR");
        btnRun.setStyle("-fx-base: #2196F3; -fx-text-fill: white; -fx-font-weight: bold;");
        btnRun.setOnAction(e -> runValidation(btnRun));

        HBox row = new HBox(10, new Label("Dataset:"), txtDataset, btnBrowse);
        row.setAlignment(Pos.CENTER);
        HBox row2 = new HBox(10, new Label("Detector:"), cmbDetector, new Label("Máx. muestras:"), txtMaxSamples, btnRun);
        row2.setAlignment(Pos.CENTER);
        lblStatus = new Label("...");
        header.getChildren().addAll(title, row, row2, lblStatus);

        GridPane statsGrid = new GridPane();
        statsGrid.setHgap(20); statsGrid.setVgap(15);
        statsGrid.setPadding(new Insets(15));
        statsGrid.setStyle("-fx-border-color: #DDD; -fx-border-radius: 8; -fx-background-color: #FAFAFA;");
        statsGrid.setAlignment(Pos.CENTER);
        valIou = createStatCard(statsGrid, "IoU medio", 0, 0);
        valPrecision = createStatCard(statsGrid, "Precisión", 1, 0);
        valRecall = createStatCard(statsGrid, "Recall", 2, 0);
        valF1 = createStatCard(statsGrid, "F1 medio", 0, 1);
        valGlobalF1 = createStatCard(statsGrid, "F1 global", 1, 1);
        valFrames = createStatCard(statsGrid, "Frames", 2, 1);

        txtReport = new TextArea();
        txtReport.setEditable(false);
        txtReport.setPrefRowCount(10);
        txtReport.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        VBox center = new VBox(20, statsGrid, txtReport);
        center.setMaxWidth(800);
        center.setAlignment(Pos.TOP_CENTER);
        center.setPadding(new Insets(20, 0, 0, 0));

        root.setTop(header);
        root.setCenter(center);
        tab.setContent(root);
        return tab;
    }

    private Label createStatCard(GridPane grid, String title, int col, int row) {
        VBox box = new VBox(5, new Label(title), new Label("--"));
        box.setAlignment(Pos.CENTER); box.setPrefWidth(120);
        ((Label) box.getChildren().get(0)).setStyle("-fx-text-fill: #666; -fx-font-size: 10px;");
        ((Label) box.getChildren().get(1)).setFont(Font.font("System", FontWeight.BOLD, 16));
        grid.add(box, col, row);
        return (Label) box.getChildren().get(1);
    }

    private void runValidation(Button btnRun) {
        File dataset = new File(txtDataset.getText().trim());
        if (!dataset.isDirectory()) {
            lblStatus.setText("❌ Dataset inválido");
            return;
        }
        int maxSamples;
        try {
            maxSamples = Integer.parseInt(txtMaxSamples.getText().trim());
        } catch (NumberFormatException e) {
            lblStatus.setText("❌ Máx. muestras debe ser un entero");
            return;
        }
        DetectorType type = cmbDetector.getValue();
        AppConfig.setValidationDir(dataset.getAbsolutePath());
        AppConfig.setDetector(type.name());

        btnRun.setDisable(true);
        lblStatus.setText("Validando...");
        new Thread(() -> {
            try {
                String cfg = AppConfig.getConfigPath();
                PipelineConfig config = PipelineConfig.load(cfg.isBlank() ? null : Path.of(cfg));
                ValidationService service = new ValidationService(config.getDetection().createDetector(type));
                File reportFile = new File(dataset, "validation_report_" + type.name().toLowerCase() + ".json");
                ValidationReport report = service.validateAndWrite(dataset, reportFile, maxSamples);
                Platform.runLater(() -> {
                    show(report);
                    lblStatus.setText("✅ " + reportFile.getName());
                    btnRun.setDisable(false);
                });
            } catch (Exception e) {
                logger.error("Validation failed on {}", dataset, e);
                Platform.runLater(() -> {
                    lblStatus.setText("❌ Error: " + e.getMessage());
                    btnRun.setDisable(false);
                });
            }
        }).start();
    }

    private void show(ValidationReport report) {
        ValidationSummary s = report.summary;
        valIou.setText(String.format("%.3f", s.meanIou));
        valPrecision.setText(String.format("%.3f", s.meanPrecision));
        valRecall.setText(String.format("%.3f", s.meanRecall));
        valF1.setText(String.format("%.3f", s.meanF1));
        valGlobalF1.setText(String.format("%.3f", s.globalF1));
        valFrames.setText(String.valueOf(s.numFrames));

        StringBuilder sb = new StringBuilder();
        sb.append("Detector: ").append(report.detector).append(" | Dataset: ").append(report.dataset).append("\n");
        sb.append("--------------------------------------------------\n");
        sb.append(String.format("IoU: %.3f ± %.3f (mediana %.3f)\n", s.meanIou, s.stdIou, s.medianIou));
        sb.append(String.format("Global: P %.3f | R %.3f | F1 %.3f\n", s.globalPrecision, s.globalRecall, s.globalF1));
        sb.append(String.format("Píxeles: TP %d | FP %d | FN %d", s.totalTp, s.totalFp, s.totalFn));
        txtReport.setText(sb.toString());
    }
}
