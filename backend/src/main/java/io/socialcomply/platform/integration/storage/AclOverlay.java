package io.socialcomply.platform.integration.storage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process ACL policies keyed by logical key. Per-key reads and writes are linearizable.
 *
 * <p>State lives in this JVM only: with more than one instance behind a load balancer, a policy
 * written on one instance is invisible to the others.
 */
public class AclOverlay {

  private final Map<String, ObjectAclPolicy> policies = new ConcurrentHashMap<>();

  public Optional<ObjectAclPolicy> get(String key) {
    return Optional.ofNullable(policies.get(key));
  }

  public void put(String key, ObjectAclPolicy policy) {
    policies.put(key, policy);
  }

  public void remove(String key) {
    policies.remove(key);
  }

  /** Replaces the visibility of the recorded policy, creating one if absent. */
  public ObjectAclPolicy updateVisibility(String key, ObjectVisibility visibility) {
    return policies.compute(
        key,
        (k, existing) ->
            existing == null
                ? ObjectAclPolicy.of(visibility)
                : existing.withVisibility(visibility));
  }

  /** Copies the source policy to the destination when one is recorded. */
  public void copy(String sourceKey, String destinationKey) {
    ObjectAclPolicy source = policies.get(sourceKey);
    if (source != null) {
      policies.put(destinationKey, retarget(source, sourceKey, destinationKey));
    }
  }

  /**
   * Policy for a copy of {@code sourceKey}. Allow-lists are carried over; a copy into the other
   * namespace takes that namespace's visibility.
   */
  public static ObjectAclPolicy retarget(
      ObjectAclPolicy policy, String sourceKey, String destinationKey) {
    Namespace from = Namespace.fromPrefix(sourceKey);
    Namespace to = Namespace.fromPrefix(destinationKey);
    if (to == null || to == from) {
      return policy;
    }
    return policy.withVisibility(to.visibility());
  }
}
