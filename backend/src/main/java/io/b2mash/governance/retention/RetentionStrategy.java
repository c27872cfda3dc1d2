package io.b2mash.governance.retention;

/**
 * Builds the row selection and deletion semantics for one entity. Called inside the policy's
 * transaction; the returned plan may be executed several times within it.
 */
@FunctionalInterface
public interface RetentionStrategy {

  RetentionPlan plan(RetentionPolicy policy);
}
