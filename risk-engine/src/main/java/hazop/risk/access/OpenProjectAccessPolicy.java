package hazop.risk.access;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@ConditionalOnProperty(prefix = "hazop.access", name = "policy", havingValue = "open", matchIfMissing = true)
public class OpenProjectAccessPolicy implements ProjectAccessPolicy {
    @Override
    public void checkAccess(String userId, UUID projectId) {
    }
}
