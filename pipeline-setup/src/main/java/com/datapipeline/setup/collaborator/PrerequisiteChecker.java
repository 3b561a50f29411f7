package com.datapipeline.setup.collaborator;

import java.util.Map;

/** Probes the local services the pipeline writes to. Keys are service names, values whether they answered. */
@FunctionalInterface
public interface PrerequisiteChecker {
  Map<String, Boolean> check() throws Exception;
}
