package com.datapipeline.core;

/** The unit of work behind a stage. A {@code null} result is treated as a stage failure. */
@FunctionalInterface
public interface StageBody {
  Object run(StageContext context) throws Exception;
}
