package io.socialcomply.platform.integration.storage.local;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.socialcomply.platform.integration.storage.ObjectAclPolicy;
import io.socialcomply.platform.integration.storage.ObjectVisibility;
import java.util.List;
import java.util.Map;

/** Contents of the {@code <name>.meta.json} file written next to every local object. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
record LocalObjectSidecar(
    String contentType,
    Map<String, String> metadata,
    String uploadedAt,
    ObjectVisibility visibility,
    List<String> allowedUsers,
    List<String> allowedRoles) {

  LocalObjectSidecar {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    visibility = visibility == null ? ObjectVisibility.PRIVATE : visibility;
    allowedUsers = allowedUsers == null ? List.of() : List.copyOf(allowedUsers);
    allowedRoles = allowedRoles == null ? List.of() : List.copyOf(allowedRoles);
  }

  ObjectAclPolicy toPolicy() {
    return new ObjectAclPolicy(visibility, allowedUsers, allowedRoles);
  }

  LocalObjectSidecar withPolicy(ObjectAclPolicy policy) {
    return new LocalObjectSidecar(
        contentType,
        metadata,
        uploadedAt,
        policy.visibility(),
        policy.allowedUsers(),
        policy.allowedRoles());
  }
}
