package hazop.risk.access;

import java.util.UUID;

/**
 * Access decision owned by the surrounding platform. Implementations throw
 * {@link hazop.risk.error.ForbiddenException} to deny.
 */
public interface ProjectAccessPolicy {
    void checkAccess(String userId, UUID projectId);
}
