package io.socialcomply.platform.integration.storage;

import java.util.List;

/**
 * Access policy for one object. Visibility is the coarse gate; the allow-lists only narrow access
 * to a {@link ObjectVisibility#PRIVATE} object.
 */
public record ObjectAclPolicy(
    ObjectVisibility visibility, List<String> allowedUsers, List<String> allowedRoles) {

  public ObjectAclPolicy {
    if (visibility == null) {
      throw new IllegalArgumentException("visibility must not be null");
    }
    allowedUsers = allowedUsers == null ? List.of() : List.copyOf(allowedUsers);
    allowedRoles = allowedRoles == null ? List.of() : List.copyOf(allowedRoles);
  }

  public static ObjectAclPolicy of(ObjectVisibility visibility) {
    return new ObjectAclPolicy(visibility, List.of(), List.of());
  }

  public ObjectAclPolicy withVisibility(ObjectVisibility newVisibility) {
    return new ObjectAclPolicy(newVisibility, allowedUsers, allowedRoles);
  }
}
