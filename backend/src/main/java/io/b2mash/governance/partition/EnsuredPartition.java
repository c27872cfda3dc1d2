package io.b2mash.governance.partition;

/**
 * A partition the rotation engine provisioned (or would provision).
 *
 * @param status "planned" in dry runs, "created" otherwise
 */
public record EnsuredPartition(String partition, String status) {

  public static final String PLANNED = "planned";
  public static final String CREATED = "created";
}
