package com.orbitalsky.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_INPUT_DIR = "input_dir";
    private static final String KEY_OUTPUT_DIR = "output_dir";
    private static final String KEY_DETECTOR = "detector";
    private static final String KEY_CONFIG_PATH = "config_path";
    private static final String KEY_VALIDATION_DIR = "validation_dir";

    // --- CARPETAS ---
    public static String getInputDir() { return prefs.get(KEY_INPUT_DIR, ""); }
    public static void setInputDir(String v) { prefs.put(KEY_INPUT_DIR, v); }

    public static String getOutputDir() { return prefs.get(KEY_OUTPUT_DIR, ""); }
    public static void setOutputDir(String v) { prefs.put(KEY_OUTPUT_DIR, v); }

    public static String getValidationDir() { return prefs.get(KEY_VALIDATION_DIR, ""); }
    public static void setValidationDir(String v) { prefs.put(KEY_VALIDATION_DIR, v); }

    // --- DETECTOR ---
    public static String getDetector() { return prefs.get(KEY_DETECTOR, "ADAPTIVE"); }
    public static void setDetector(String v) { prefs.put(KEY_DETECTOR, v); }

    // Sin default: el usuario elige el YAML o se usan los valores internos
    public static String getConfigPath() { return prefs.get(KEY_CONFIG_PATH, ""); }
    public static void setConfigPath(String v) { prefs.put(KEY_CONFIG_PATH, v); }
}
