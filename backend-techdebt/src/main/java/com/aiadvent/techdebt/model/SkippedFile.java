package com.aiadvent.techdebt.model;

/** A supplied file that did not make it into the scan, with the reason. */
public record SkippedFile(String path, Reason reason, String detail) {

  public enum Reason {
    IGNORED,
    TOO_LARGE,
    UNREADABLE,
    FAILED,
    TIMED_OUT
  }
}
