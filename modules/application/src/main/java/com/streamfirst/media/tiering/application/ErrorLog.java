package com.streamfirst.media.tiering.application;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects error messages for a run summary, keeping at most {@link #MAX_ERRORS}. {@link #total()}
 * counts every message, including those not kept.
 */
final class ErrorLog {

  static final int MAX_ERRORS = 50;

  private final List<String> messages = new ArrayList<>();
  private int total;

  void add(String message) {
    total++;
    if (messages.size() < MAX_ERRORS) {
      messages.add(message);
    }
  }

  int total() {
    return total;
  }

  List<String> toList() {
    return List.copyOf(messages);
  }
}
