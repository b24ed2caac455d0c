package com.verlumen.chrono.execution;

import com.google.common.base.Ascii;

/** WET runs publish to external systems; DRY runs keep everything in process. */
public enum RunMode {
  WET,
  DRY;

  public static RunMode fromString(String name) {
    try {
      return RunMode.valueOf(Ascii.toUpperCase(name));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown run mode: " + name, e);
    }
  }
}
