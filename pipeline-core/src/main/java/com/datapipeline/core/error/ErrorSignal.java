package com.datapipeline.core.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Everything a classification rule may look at, gathered once from the error and its cause chain:
 * the throwables themselves, their lower-cased messages, error codes and HTTP statuses.
 */
public final class ErrorSignal {
  private final List<Throwable> chain;
  private final List<String> messages = new ArrayList<>();
  private final List<String> codes = new ArrayList<>();
  private final List<Integer> statuses = new ArrayList<>();

  private ErrorSignal(List<Throwable> chain) {
    this.chain = chain;
    for (Throwable t : chain) {
      if (t.getMessage() != null) messages.add(t.getMessage().toLowerCase(Locale.ROOT));
      if (t instanceof ErrorCodeAware coded) {
        if (coded.errorCode() != null) codes.add(coded.errorCode().toUpperCase(Locale.ROOT));
        coded.statusCode().ifPresent(statuses::add);
      }
    }
  }

  public static ErrorSignal of(Throwable error) {
    List<Throwable> chain = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable t = error; t != null && seen.add(t); t = t.getCause()) chain.add(t);
    return new ErrorSignal(List.copyOf(chain));
  }

  public boolean isA(Class<? extends Throwable> type) {
    for (Throwable t : chain) {
      if (type.isInstance(t)) return true;
    }
    return false;
  }

  /** Matches by simple class name anywhere in a throwable's type hierarchy, for types this module cannot import. */
  public boolean hasTypeNamed(String simpleName) {
    for (Throwable t : chain) {
      for (Class<?> c = t.getClass(); c != null && c != Throwable.class; c = c.getSuperclass()) {
        if (c.getSimpleName().equals(simpleName)) return true;
      }
    }
    return false;
  }

  public boolean messageContains(String fragment) {
    for (String m : messages) {
      if (m.contains(fragment)) return true;
    }
    return false;
  }

  public boolean hasCode(String code) {
    return codes.contains(code);
  }

  public boolean hasStatus(int status) {
    return statuses.contains(status);
  }

  public boolean hasStatusAtLeast(int status) {
    for (int s : statuses) {
      if (s >= status) return true;
    }
    return false;
  }
}
