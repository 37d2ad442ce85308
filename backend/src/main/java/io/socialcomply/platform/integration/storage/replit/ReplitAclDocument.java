package io.socialcomply.platform.integration.storage.replit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.socialcomply.platform.integration.storage.ObjectAclPolicy;
import io.socialcomply.platform.integration.storage.ObjectVisibility;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON stored in the {@code custom:aclPolicy} object metadata entry. Visibility is lowercase;
 * {@code owner} is the first allowed user and is folded back into the allow-list on read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ReplitAclDocument(
    String owner, String visibility, List<String> allowedUsers, List<String> allowedRoles) {

  static final String METADATA_KEY = "custom:aclPolicy";

  static ReplitAclDocument from(ObjectAclPolicy policy) {
    List<String> users = policy.allowedUsers();
    return new ReplitAclDocument(
        users.isEmpty() ? "" : users.get(0),
        policy.visibility().name().toLowerCase(Locale.ROOT),
        users,
        policy.allowedRoles());
  }

  ObjectAclPolicy toPolicy() {
    var users = new ArrayList<String>();
    if (allowedUsers != null) {
      users.addAll(allowedUsers);
    }
    if (owner != null && !owner.isBlank() && !users.contains(owner)) {
      users.add(0, owner);
    }
    var resolved =
        "public".equalsIgnoreCase(visibility) ? ObjectVisibility.PUBLIC : ObjectVisibility.PRIVATE;
    return new ObjectAclPolicy(resolved, users, allowedRoles);
  }
}
