package com.orbitalsky.service;

import java.io.IOException;

/** A FITS file that opens fine but carries no 2-D image in any HDU. */
public class NoPixelDataException extends IOException {
    public NoPixelDataException(String message) {
        super(message);
    }
}
