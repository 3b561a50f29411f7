package com.datapipeline.core.error;

public enum RecoveryStrategy {
  /** The recovery operation may be invoked again, with backoff. */
  RETRY,
  /** No automatic recovery; surfaced immediately. */
  FAIL_FAST,
  /** Logged with an operator guide; never retried automatically. */
  MANUAL_INTERVENTION,
  /** Substitute degraded or cached data. */
  FALLBACK
}
