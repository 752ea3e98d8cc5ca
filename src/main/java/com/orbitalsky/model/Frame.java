package com.orbitalsky.model;

import java.io.File;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One observed frame: pixel data indexed {@code data[y][x]}, the header cards of the HDU it came from,
 * its source path and the observation timestamp when the header carried one.
 * <p>
 * The pixel array is shared, not copied. Nothing in the pipeline writes into it.
 */
public class Frame {
    public final double[][] data;
    public final Map<String, String> header;
    public final String path;
    public final String timestampUtc; // null si el header no trae DATE-OBS/DATE

    public Frame(double[][] data, Map<String, String> header, String path, String timestampUtc) {
        this.data = data;
        this.header = (header == null) ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(header));
        this.path = path;
        this.timestampUtc = timestampUtc;
    }

    public Frame(double[][] data, String path) {
        this(data, null, path, null);
    }

    public int width() { return data.length == 0 ? 0 : data[0].length; }
    public int height() { return data.length; }
    public long pixelCount() { return (long) width() * height(); }

    public String fileName() {
        if (path == null || path.isEmpty()) return "UNKNOWN";
        return new File(path).getName();
    }
}
