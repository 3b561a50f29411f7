package com.datapipeline.core;

import java.util.List;
import java.util.Map;

/** Chooses the stages an operation needs, given the options the pipeline is being built with. */
@FunctionalInterface
public interface StageSelector {
  List<String> select(Map<String, Object> options);

  static StageSelector fixed(String... stageNames) {
    List<String> names = List.of(stageNames);
    return options -> names;
  }

  static StageSelector fixed(List<String> stageNames) {
    List<String> names = List.copyOf(stageNames);
    return options -> names;
  }
}
