package com.modelsync.core.rules;

import com.modelsync.core.descriptor.ConnectionRule;

/**
 * Result of validating a connection.
 *
 * @param valid whether the connection is allowed
 * @param reason explanation when rejected, null otherwise
 * @param matchedRule the rule that allowed it, null for rejections and permissive defaults
 */
public record ConnectionCheck(boolean valid, String reason, ConnectionRule matchedRule) {

    public static ConnectionCheck allowedBy(ConnectionRule rule) {
        return new ConnectionCheck(true, null, rule);
    }

    public static ConnectionCheck allowedByDefault() {
        return new ConnectionCheck(true, null, null);
    }

    public static ConnectionCheck rejected(String reason) {
        return new ConnectionCheck(false, reason, null);
    }
}
