package com.draupnir.policy.config;

import lombok.Data;

/**
 * Organisation rules that decide which heuristic findings the validator reports.
 * Defaults reproduce the stock checks: DNS egress and L4/L7 port warnings on,
 * wildcard FQDN warnings off.
 */
@Data
public class PolicyRulesConfig {

    /**
     * Warn when egress has neither a port 53 rule nor toFQDNs
     */
    private boolean requireDnsEgress = true;

    /**
     * Warn when a rule direction has no populated toPorts
     */
    private boolean requireL7Ports = true;

    /**
     * Warn for every toFQDNs selector containing '*'
     */
    private boolean forbidWildcardFqdns = false;

    public static PolicyRulesConfig defaults() {
        return new PolicyRulesConfig();
    }
}
