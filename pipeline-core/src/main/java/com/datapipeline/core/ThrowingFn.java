package com.datapipeline.core;

/** A one-argument function allowed to throw; collaborator calls and wrapped recovery functions use this shape. */
@FunctionalInterface
public interface ThrowingFn<I, O> {
  O apply(I in) throws Exception;
}
