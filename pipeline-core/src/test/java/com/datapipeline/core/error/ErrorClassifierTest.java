package com.datapipeline.core.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.file.AccessDeniedException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

final class ErrorClassifierTest {

  private final ErrorClassifier classifier = ErrorClassifier.defaults();

  @Test
  void connectionRefusedIsRetryableServiceOutage() {
    ErrorClassification c = classifier.classify(new CollaboratorException("ECONNREFUSED", "connect failed"));

    assertEquals(ErrorType.SERVICE_UNAVAILABLE, c.type());
    assertEquals(ErrorSeverity.HIGH, c.severity());
    assertEquals(RecoveryStrategy.RETRY, c.strategy());
  }

  @Test
  void serverStatusCodesMeanServiceUnavailable() {
    assertEquals(ErrorType.SERVICE_UNAVAILABLE,
        classifier.classify(new CollaboratorException("HTTP", 503, "upstream said no")).type());
  }

  @Test
  void permissionProblemsNeedAHuman() {
    ErrorClassification c = classifier.classify(new AccessDeniedException("/var/data/images"));

    assertEquals(ErrorType.PERMISSION, c.type());
    assertEquals(RecoveryStrategy.MANUAL_INTERVENTION, c.strategy());
    assertEquals(ErrorType.PERMISSION,
        classifier.classify(new CollaboratorException("HTTP", 403, "nope")).type());
  }

  @Test
  void timeoutsAreRetried() {
    assertEquals(ErrorType.TIMEOUT, classifier.classify(new SocketTimeoutException("read")).type());
    assertEquals(ErrorType.TIMEOUT, classifier.classify(new RuntimeException("Operation timed out")).type());
  }

  @Test
  void resourceExhaustionFailsFast() {
    ErrorClassification c = classifier.classify(new IOException("No space left on device"));

    assertEquals(ErrorType.RESOURCE_EXHAUSTION, c.type());
    assertEquals(ErrorSeverity.CRITICAL, c.severity());
    assertEquals(RecoveryStrategy.FAIL_FAST, c.strategy());
  }

  @Test
  void malformedPayloadIsDataCorruption() {
    assertEquals(ErrorType.DATA_CORRUPTION,
        classifier.classify(new IllegalArgumentException("Malformed JSON in seed file")).type());
  }

  @Test
  void validationErrorsAreLowSeverity() {
    ErrorClassification c = classifier.classify(new CollaboratorException("EVALIDATION", "3 rows rejected"));

    assertEquals(ErrorType.VALIDATION, c.type());
    assertEquals(ErrorSeverity.LOW, c.severity());
  }

  @Test
  void signalsAreFoundAlongTheCauseChain() {
    Exception wrapped = new IllegalStateException("stage failed",
        new RuntimeException("while uploading", new SocketTimeoutException("read")));

    assertEquals(ErrorType.TIMEOUT, classifier.classify(wrapped).type());
  }

  @Test
  void anythingElseIsUnknown() {
    assertEquals(ErrorClassifier.UNCLASSIFIED, classifier.classify(new RuntimeException("boom")));
  }

  @Test
  void extraRulesWinOverDefaults() {
    ErrorClassification custom = new ErrorClassification(ErrorType.VALIDATION, ErrorSeverity.LOW,
        RecoveryStrategy.FALLBACK);
    ErrorClassifier withExtra = ErrorClassifier.withRules(List.of(
        new ClassificationRule("quota", s -> s.messageContains("quota"), custom)));

    assertEquals(custom, withExtra.classify(new RuntimeException("quota exceeded, network busy")));
    assertEquals(ErrorType.SERVICE_UNAVAILABLE,
        classifier.classify(new RuntimeException("quota exceeded, network busy")).type());
  }
}
