package io.wfpath.query;

/** Counts the workflow executions matching a rendered filter. */
@FunctionalInterface
public interface CountFunction {
  long count(String query) throws Exception;
}
