package com.orbitalsky.main;

import com.orbitalsky.ui.PipelineTab;
import com.orbitalsky.ui.ValidationTab;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;

public class OrbitalSkyApp extends Application {

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("🛰️ OrbitalSkyShield");

        TabPane tabPane = new TabPane();
        tabPane.getTabs().add(new PipelineTab().create());   // 1. Procesar noche
        tabPane.getTabs().add(new ValidationTab().create()); // 2. Validar detector

        Scene scene = new Scene(tabPane, 1024, 850);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
