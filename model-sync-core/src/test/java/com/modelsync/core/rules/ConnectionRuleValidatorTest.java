package com.modelsync.core.rules;

import com.modelsync.core.descriptor.ConnectionRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConnectionRuleValidator}.
 */
class ConnectionRuleValidatorTest {

    private static final ConnectionRule EXTENDS_OUT_TO_IN =
        ConnectionRule.of("edge:extends", "node:entity", "node:entity").withPorts("out", "in");

    private final ConnectionRuleValidator validator = new ConnectionRuleValidator(List.of(EXTENDS_OUT_TO_IN));

    @Test
    void check_matchingPorts_isAllowedByRule() {
        ConnectionCheck check = validator.check("edge:extends",
            new ConnectionEndpoint("a", "node:entity", "out"),
            new ConnectionEndpoint("b", "node:entity", "in"));

        assertThat(check.valid()).isTrue();
        assertThat(check.matchedRule()).isEqualTo(EXTENDS_OUT_TO_IN);
    }

    @Test
    void check_wrongSourcePort_isRejectedWithReason() {
        ConnectionCheck check = validator.check("edge:extends",
            new ConnectionEndpoint("a", "node:entity", "in"),
            new ConnectionEndpoint("b", "node:entity", "in"));

        assertThat(check.valid()).isFalse();
        assertThat(check.reason()).contains("edge:extends").contains("node:entity.in");
    }

    @Test
    void check_edgeTypeWithoutRules_isAllowedByDefault() {
        ConnectionCheck check = validator.check("edge:target",
            ConnectionEndpoint.of("a", "node:entity"),
            ConnectionEndpoint.of("b", "node:package"));

        assertThat(check.valid()).isTrue();
        assertThat(check.matchedRule()).isNull();
    }

    @Test
    void check_selfConnectionWithoutPermission_isRejectedEvenWithoutRules() {
        assertThat(validator.isValid("edge:target",
            ConnectionEndpoint.of("a", "node:entity"),
            ConnectionEndpoint.of("a", "node:entity"))).isFalse();
        assertThat(validator.isValid("edge:extends",
            new ConnectionEndpoint("a", "node:entity", "out"),
            new ConnectionEndpoint("a", "node:entity", "in"))).isFalse();
    }

    @Test
    void check_selfConnectionAllowedByRule_isValid() {
        ConnectionRuleValidator selfAware = new ConnectionRuleValidator(List.of(
            ConnectionRule.of("edge:extends", "node:entity", "node:entity").allowingSelfConnection()));

        assertThat(selfAware.isValid("edge:extends",
            ConnectionEndpoint.of("a", "node:entity"),
            ConnectionEndpoint.of("a", "node:entity"))).isTrue();
    }

    @Test
    void check_wildcardRule_matchesAnyTypeButDoesNotConstrainEdgeType() {
        ConnectionRuleValidator wildcard = new ConnectionRuleValidator(List.of(
            ConnectionRule.of("*", "node:package", "*")));

        assertThat(wildcard.hasRulesFor("edge:target")).isFalse();
        assertThat(wildcard.check("edge:target",
            ConnectionEndpoint.of("p", "node:package"),
            ConnectionEndpoint.of("e", "node:entity")).matchedRule()).isNotNull();
    }

    @Test
    void check_ruleWithoutPort_matchesEndpointWithOrWithoutPort() {
        ConnectionRuleValidator portless = new ConnectionRuleValidator(List.of(
            ConnectionRule.of("edge:extends", "node:entity", "node:entity")));

        assertThat(portless.isValid("edge:extends",
            new ConnectionEndpoint("a", "node:entity", "out"),
            ConnectionEndpoint.of("b", "node:entity"))).isTrue();
        assertThat(portless.isValid("edge:extends",
            ConnectionEndpoint.of("a", "node:package"),
            ConnectionEndpoint.of("b", "node:entity"))).isFalse();
    }
}
