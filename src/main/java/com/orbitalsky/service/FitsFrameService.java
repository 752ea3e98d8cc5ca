package com.orbitalsky.service;

import com.orbitalsky.model.Frame;
import com.orbitalsky.model.Mask;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.fits.ImageHDU;
import nom.tam.util.Cursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class FitsFrameService {
    private static final Logger logger = LoggerFactory.getLogger(FitsFrameService.class);

    public static final String MASK_KEYWORD = "OSS_MASK";

    // Tarjetas que describen la estructura del HDU original; no se copian a la máscara
    private static final Set<String> STRUCTURAL = Set.of(
            "SIMPLE", "XTENSION", "BITPIX", "NAXIS", "NAXIS1", "NAXIS2", "NAXIS3", "EXTEND",
            "PCOUNT", "GCOUNT", "BSCALE", "BZERO", "BLANK", "END", "COMMENT", "HISTORY", "CHECKSUM", "DATASUM");

    public Frame read(File f) throws IOException {
        if (!f.isFile()) throw new FileNotFoundException("FITS file not found: " + f);

        try (Fits fits = new Fits(f)) {
            BasicHDU<?>[] hdus = fits.read();
            BasicHDU<?> hdu = firstImage(hdus);
            if (hdu == null) throw new NoPixelDataException("No image data in " + f.getName());

            Header header = hdu.getHeader();
            double bscale = header.getDoubleValue("BSCALE", 1.0);
            double bzero = header.getDoubleValue("BZERO", 0.0);
            double[][] data = toDouble(hdu.getKernel(), bscale, bzero);
            if (data == null) {
                throw new IOException("Unsupported image layout in " + f.getName() + " (expected a 2-D array)");
            }

            Map<String, String> cards = headerToMap(header);
            String timestamp = cards.containsKey("DATE-OBS") ? cards.get("DATE-OBS") : cards.get("DATE");
            logger.debug("Read {} ({}x{})", f.getName(), data.length == 0 ? 0 : data[0].length, data.length);
            return new Frame(data, cards, f.getPath(), timestamp);
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS " + f.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the mask as an 8-bit image. Value cards of {@code sourceHeader} are carried over (structural
     * keywords excluded) and {@code OSS_MASK = T} is added.
     */
    public void writeMask(File out, Mask mask, Map<String, String> sourceHeader) throws IOException {
        File parent = out.getAbsoluteFile().getParentFile();
        if (parent != null) Files.createDirectories(parent.toPath());
        Files.deleteIfExists(out.toPath());

        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(mask.pixels);
            Header header = hdu.getHeader();
            if (sourceHeader != null) {
                for (Map.Entry<String, String> e : sourceHeader.entrySet()) {
                    copyCard(header, e.getKey(), e.getValue());
                }
            }
            header.addValue(MASK_KEYWORD, true, "streak mask written by OrbitalSkyShield");
            fits.addHDU(hdu);
            fits.write(out);
        } catch (FitsException e) {
            throw new IOException("Cannot write mask " + out.getName() + ": " + e.getMessage(), e);
        }
    }

    private static BasicHDU<?> firstImage(BasicHDU<?>[] hdus) {
        if (hdus == null) return null;
        for (BasicHDU<?> hdu : hdus) {
            int naxis = hdu.getHeader().getIntValue("NAXIS", 0);
            if (hdu instanceof ImageHDU && naxis > 0 && hdu.getKernel() != null) return hdu;
        }
        return null;
    }

    private static Map<String, String> headerToMap(Header header) {
        Map<String, String> map = new LinkedHashMap<>();
        Cursor<String, HeaderCard> it = header.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            String key = card.getKey();
            String value = card.getValue();
            if (key == null || key.isBlank() || value == null) continue;
            map.putIfAbsent(key.trim(), value.trim());
        }
        return map;
    }

    private static void copyCard(Header header, String key, String value) {
        if (STRUCTURAL.contains(key) || key.startsWith("NAXIS") || key.length() > 8) return;
        try {
            if ("T".equals(value) || "F".equals(value)) {
                header.addValue(key, "T".equals(value), null);
            } else if (isNumeric(value)) {
                header.addValue(key, Double.parseDouble(value), null);
            } else {
                header.addValue(key, value, null);
            }
        } catch (Exception e) {
            logger.debug("Skipping header card {} in mask: {}", key, e.getMessage());
        }
    }

    private static boolean isNumeric(String v) {
        if (v.isEmpty()) return false;
        try {
            Double.parseDouble(v);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    static double[][] toDouble(Object k, double bscale, double bzero) {
        if (k instanceof byte[][]) {
            byte[][] b = (byte[][]) k;
            double[][] d = new double[b.length][b.length == 0 ? 0 : b[0].length];
            for (int i = 0; i < b.length; i++) for (int j = 0; j < b[i].length; j++) d[i][j] = (b[i][j] & 0xFF) * bscale + bzero;
            return d;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = s[i][j] * bscale + bzero;
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = s[i][j] * bscale + bzero;
            return d;
        }
        if (k instanceof long[][]) {
            long[][] s = (long[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = s[i][j] * bscale + bzero;
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][f.length == 0 ? 0 : f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[i].length; j++) d[i][j] = f[i][j] * bscale + bzero;
            return d;
        }
        if (k instanceof double[][]) {
            double[][] s = (double[][]) k;
            double[][] d = new double[s.length][s.length == 0 ? 0 : s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[i].length; j++) d[i][j] = s[i][j] * bscale + bzero;
            return d;
        }
        return null;
    }
}
