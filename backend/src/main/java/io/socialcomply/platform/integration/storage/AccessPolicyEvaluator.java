package io.socialcomply.platform.integration.storage;

/**
 * Fail-closed access rule shared by every adapter.
 *
 * <ol>
 *   <li>No recorded policy: only {@code READ} on a structurally public object is allowed, so
 *       objects that predate ACL tracking stay readable if they were always public.
 *   <li>{@code PUBLIC} policy and {@code READ}: allowed.
 *   <li>Otherwise the user must be named in {@code allowedUsers}. Role lists never grant access.
 * </ol>
 */
public final class AccessPolicyEvaluator {

  private AccessPolicyEvaluator() {}

  public static boolean canAccess(
      ObjectAclPolicy policy,
      boolean structurallyPublic,
      String userId,
      ObjectPermission permission) {
    if (policy == null) {
      return structurallyPublic && permission == ObjectPermission.READ;
    }
    if (policy.visibility() == ObjectVisibility.PUBLIC && permission == ObjectPermission.READ) {
      return true;
    }
    if (userId == null) {
      return false;
    }
    // allowedRoles is reserved and never grants
    return policy.allowedUsers().contains(userId);
  }
}
