package com.onthegomap.tilestate.source;

/**
 * Error encountered while decoding GeoJSON or a source diff.
 */
public class GeoJsonFormatException extends RuntimeException {
  public GeoJsonFormatException(String message) {
    super(message);
  }

  public GeoJsonFormatException(String message, Throwable throwable) {
    super(message, throwable);
  }
}
