package org.qbitspark.filevaultbackend.globesecurity;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Caller identity and request metadata as resolved by the transport/auth layer.
 * {@code userId} is null for anonymous callers (public share links).
 */
@Value
@Builder(toBuilder = true)
public class AccessContext {

    UUID userId;
    boolean privileged;
    String ipAddress;
    String userAgent;
    // Origin header or host of the requesting page, used for share domain restrictions
    String origin;

    public static AccessContext user(UUID userId) {
        return AccessContext.builder().userId(userId).build();
    }

    public static AccessContext admin(UUID userId) {
        return AccessContext.builder().userId(userId).privileged(true).build();
    }

    public static AccessContext anonymous(String origin) {
        return AccessContext.builder().origin(origin).build();
    }

    // Background jobs: privileged, but attributed to no user
    public static AccessContext system() {
        return AccessContext.builder().privileged(true).build();
    }

    public boolean isAuthenticated() {
        return userId != null;
    }
}
