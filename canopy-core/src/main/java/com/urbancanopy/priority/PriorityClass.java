package com.urbancanopy.priority;

import com.urbancanopy.config.CanopyConfig;

/** Priority band of a pixel, ordered from least to most urgent. */
public enum PriorityClass {
  NOT_PLANTABLE("not_plantable"),
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high"),
  CRITICAL("critical");

  private static final PriorityClass[] VALUES = values();
  private final String id;

  PriorityClass(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  static PriorityClass fromOrdinal(int ordinal) {
    return VALUES[ordinal];
  }

  /** Returns the band of a plantable pixel with {@code score}. */
  public static PriorityClass of(double score, CanopyConfig config) {
    if (score >= config.criticalMinScore()) {
      return CRITICAL;
    } else if (score >= config.highMinScore()) {
      return HIGH;
    } else if (score >= config.mediumMinScore()) {
      return MEDIUM;
    }
    return LOW;
  }
}
