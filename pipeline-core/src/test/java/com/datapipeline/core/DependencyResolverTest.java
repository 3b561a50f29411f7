package com.datapipeline.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class DependencyResolverTest {

  static List<StageDefinition> setupStages() {
    return List.of(
        StageDefinition.builder("vp").build(),
        StageDefinition.builder("dc").dependsOn("vp").build(),
        StageDefinition.builder("process-images").dependsOn("dc").parallel(true).critical(false).build(),
        StageDefinition.builder("seed-database").dependsOn("dc").parallel(true).build(),
        StageDefinition.builder("sync-frontend").dependsOn("dc").parallel(true).critical(false).build(),
        StageDefinition.builder("validate-data").dependsOn("dc").build(),
        StageDefinition.builder("update-state").dependsOn("validate-data").build());
  }

  @Test
  void parallelStagesOfOneLayerShareAGroup() {
    List<List<StageDefinition>> plan = DependencyResolver.resolve(setupStages());

    assertEquals(List.of(
        List.of("vp"),
        List.of("dc"),
        List.of("process-images", "seed-database", "sync-frontend"),
        List.of("validate-data"),
        List.of("update-state")), names(plan));
  }

  @Test
  void everyStageAppearsInExactlyOneGroupAfterItsDependencies() {
    List<List<StageDefinition>> plan = DependencyResolver.resolve(setupStages());

    List<String> seen = new ArrayList<>();
    for (List<StageDefinition> group : plan) {
      for (StageDefinition s : group) {
        for (String dep : s.dependencies()) {
          assertTrue(seen.contains(dep), s.name() + " scheduled before " + dep);
        }
      }
      for (StageDefinition s : group) seen.add(s.name());
    }
    assertEquals(7, seen.size());
    assertEquals(7, Set.copyOf(seen).size());
  }

  @Test
  void dependenciesOutsideTheSubsetAreIgnored() {
    List<StageDefinition> subset = List.of(
        StageDefinition.builder("process-images").dependsOn("dc").parallel(true).build(),
        StageDefinition.builder("validate-data").dependsOn("dc").build());

    assertEquals(List.of(List.of("process-images"), List.of("validate-data")),
        names(DependencyResolver.resolve(subset)));
  }

  @Test
  void cycleIsReportedWithTheStagesLeft() {
    List<StageDefinition> stages = List.of(
        StageDefinition.builder("root").build(),
        StageDefinition.builder("a").dependsOn("root", "b").build(),
        StageDefinition.builder("b").dependsOn("a").build());

    CircularDependencyException e = assertThrows(CircularDependencyException.class,
        () -> DependencyResolver.resolve(stages));

    assertEquals(List.of("a", "b"), e.unresolved());
    assertTrue(e.getMessage().contains("Circular dependency"));
  }

  @Test
  void duplicateStageNamesAreRejected() {
    List<StageDefinition> stages = List.of(
        StageDefinition.builder("a").build(),
        StageDefinition.builder("a").build());

    assertThrows(IllegalArgumentException.class, () -> DependencyResolver.resolve(stages));
  }

  @Test
  void emptyInputGivesEmptyPlan() {
    assertTrue(DependencyResolver.resolve(List.of()).isEmpty());
  }

  private static List<List<String>> names(List<List<StageDefinition>> plan) {
    List<List<String>> out = new ArrayList<>();
    for (List<StageDefinition> g : plan) {
      List<String> n = new ArrayList<>();
      for (StageDefinition s : g) n.add(s.name());
      out.add(n);
    }
    return out;
  }
}
