package com.modelsync.core.rules;

import com.modelsync.core.descriptor.ConnectionRule;
import com.modelsync.core.descriptor.LanguageDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether an edge may connect two endpoints.
 *
 * <p>A connection is valid when at least one rule matches every field:
 * <ul>
 *   <li>{@code *} matches any edge type, node type or port</li>
 *   <li>a rule without a port matches any port and no port</li>
 *   <li>a rule port other than {@code *} matches only that port</li>
 * </ul>
 *
 * <p>When source and target are the same element, the matching rule must also set
 * {@code allowSelfConnection}. Edge types that no rule names explicitly are allowed
 * between any nodes; {@link #unconstrainedEdgeTypes(LanguageDescriptor)} lists them so a
 * validation pass can flag the gap.
 */
public class ConnectionRuleValidator {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRuleValidator.class);

    private final List<ConnectionRule> rules;

    public ConnectionRuleValidator(List<ConnectionRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    public static ConnectionRuleValidator forDescriptor(LanguageDescriptor descriptor) {
        return new ConnectionRuleValidator(descriptor.connectionRules());
    }

    public boolean isValid(String edgeType, ConnectionEndpoint source, ConnectionEndpoint target) {
        return check(edgeType, source, target).valid();
    }

    /**
     * Validates a connection and explains rejections.
     *
     * @param edgeType edge type
     * @param source source endpoint
     * @param target target endpoint
     * @return validation result
     */
    public ConnectionCheck check(String edgeType, ConnectionEndpoint source, ConnectionEndpoint target) {
        boolean selfConnection = source.elementId().equals(target.elementId());

        for (ConnectionRule rule : rules) {
            if (matches(rule, edgeType, source, target) && (!selfConnection || rule.allowSelfConnection())) {
                return ConnectionCheck.allowedBy(rule);
            }
        }

        if (selfConnection) {
            return ConnectionCheck.rejected("Self-connection not allowed for " + edgeType + " on " + source.nodeType());
        }

        if (!hasRulesFor(edgeType)) {
            log.debug("No connection rules for edge type {}, allowing by default", edgeType);
            return ConnectionCheck.allowedByDefault();
        }

        return ConnectionCheck.rejected(String.format("No rule allows %s from %s%s to %s%s",
            edgeType, source.nodeType(), portSuffix(source), target.nodeType(), portSuffix(target)));
    }

    /**
     * Whether any rule names this edge type explicitly. Wildcard rules can allow an edge
     * type but do not make it constrained.
     */
    public boolean hasRulesFor(String edgeType) {
        return rules.stream().anyMatch(rule -> rule.edgeType().equals(edgeType));
    }

    /**
     * Lists declared edge types that no rule names explicitly.
     *
     * @param descriptor language descriptor
     * @return edge types connected by the permissive default
     */
    public Set<String> unconstrainedEdgeTypes(LanguageDescriptor descriptor) {
        Set<String> unconstrained = new LinkedHashSet<>();
        for (String edgeType : descriptor.supportedEdgeTypes()) {
            if (!hasRulesFor(edgeType)) {
                unconstrained.add(edgeType);
            }
        }
        return unconstrained;
    }

    private static boolean matches(ConnectionRule rule, String edgeType,
                                   ConnectionEndpoint source, ConnectionEndpoint target) {
        return matchesType(rule.edgeType(), edgeType)
            && matchesType(rule.sourceType(), source.nodeType())
            && matchesPort(rule.sourcePort(), source.portId())
            && matchesType(rule.targetType(), target.nodeType())
            && matchesPort(rule.targetPort(), target.portId());
    }

    private static boolean matchesType(String pattern, String value) {
        return ConnectionRule.WILDCARD.equals(pattern) || pattern.equals(value);
    }

    private static boolean matchesPort(String pattern, String portId) {
        if (pattern == null || ConnectionRule.WILDCARD.equals(pattern)) {
            return true;
        }
        return pattern.equals(portId);
    }

    private static String portSuffix(ConnectionEndpoint endpoint) {
        return endpoint.portId() != null ? "." + endpoint.portId() : "";
    }
}
