package com.datapipeline.core.error;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.AccessDeniedException;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Maps an error to a {@link ErrorClassification} by walking an ordered rule list; the first rule that
 * matches wins, and {@link #UNCLASSIFIED} is returned when none does. Stateless and thread-safe.
 */
public final class ErrorClassifier {
  public static final ErrorClassification UNCLASSIFIED =
      new ErrorClassification(ErrorType.UNKNOWN, ErrorSeverity.MEDIUM, RecoveryStrategy.FAIL_FAST);

  private final List<ClassificationRule> rules;

  public ErrorClassifier(List<ClassificationRule> rules) {
    this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
  }

  public static ErrorClassifier defaults() {
    return new ErrorClassifier(defaultRules());
  }

  /** A classifier that tries {@code extra} before the default rules. */
  public static ErrorClassifier withRules(List<ClassificationRule> extra) {
    List<ClassificationRule> all = new ArrayList<>(extra);
    all.addAll(defaultRules());
    return new ErrorClassifier(all);
  }

  public ErrorClassification classify(Throwable error) {
    Objects.requireNonNull(error, "error");
    ErrorSignal signal = ErrorSignal.of(error);
    for (ClassificationRule rule : rules) {
      if (rule.matches(signal)) return rule.classification();
    }
    return UNCLASSIFIED;
  }

  public List<ClassificationRule> rules() {
    return rules;
  }

  public static List<ClassificationRule> defaultRules() {
    return List.of(
        new ClassificationRule("resource-exhaustion",
            s -> s.isA(OutOfMemoryError.class)
                || s.hasCode("ENOMEM") || s.hasCode("ENOSPC")
                || s.messageContains("out of memory") || s.messageContains("no space left")
                || s.messageContains("heap space"),
            of(ErrorType.RESOURCE_EXHAUSTION, ErrorSeverity.CRITICAL, RecoveryStrategy.FAIL_FAST)),

        new ClassificationRule("permission",
            s -> s.isA(AccessDeniedException.class) || s.isA(SecurityException.class)
                || s.hasCode("EACCES") || s.hasCode("EPERM")
                || s.hasStatus(401) || s.hasStatus(403)
                || s.messageContains("permission denied") || s.messageContains("access denied")
                || s.messageContains("unauthorized") || s.messageContains("forbidden"),
            of(ErrorType.PERMISSION, ErrorSeverity.HIGH, RecoveryStrategy.MANUAL_INTERVENTION)),

        new ClassificationRule("timeout",
            s -> s.isA(TimeoutException.class) || s.isA(SocketTimeoutException.class)
                || s.isA(HttpTimeoutException.class)
                || s.hasCode("ETIMEDOUT") || s.hasCode("TIMEOUT")
                || s.messageContains("timed out") || s.messageContains("timeout"),
            of(ErrorType.TIMEOUT, ErrorSeverity.MEDIUM, RecoveryStrategy.RETRY)),

        new ClassificationRule("service-unavailable",
            s -> s.isA(ConnectException.class) || s.isA(UnknownHostException.class)
                || s.isA(NoRouteToHostException.class)
                || s.hasCode("ECONNREFUSED") || s.hasCode("ENOTFOUND") || s.hasCode("ECONNRESET")
                || s.hasStatusAtLeast(500)
                || s.messageContains("connection refused") || s.messageContains("connection reset")
                || s.messageContains("unavailable") || s.messageContains("network"),
            of(ErrorType.SERVICE_UNAVAILABLE, ErrorSeverity.HIGH, RecoveryStrategy.RETRY)),

        new ClassificationRule("data-corruption",
            s -> s.hasTypeNamed("JsonProcessingException")
                || s.isA(ParseException.class) || s.isA(CharacterCodingException.class)
                || s.messageContains("malformed") || s.messageContains("unexpected token")
                || s.messageContains("syntax error") || s.messageContains("corrupt"),
            of(ErrorType.DATA_CORRUPTION, ErrorSeverity.HIGH, RecoveryStrategy.FALLBACK)),

        new ClassificationRule("validation",
            s -> s.hasStatus(400) || s.hasCode("EVALIDATION")
                || s.messageContains("validation") || s.messageContains("invalid data")
                || s.messageContains("schema"),
            of(ErrorType.VALIDATION, ErrorSeverity.LOW, RecoveryStrategy.FALLBACK))
    );
  }

  private static ErrorClassification of(ErrorType type, ErrorSeverity severity, RecoveryStrategy strategy) {
    return new ErrorClassification(type, severity, strategy);
  }
}
