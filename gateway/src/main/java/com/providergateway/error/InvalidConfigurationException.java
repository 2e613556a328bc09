package com.providergateway.error;

import java.util.List;

/**
 * A provider definition failed validation. Carries every violation found, not
 * just the first.
 */
public class InvalidConfigurationException extends GatewayException {

    private final List<String> violations;

    public InvalidConfigurationException(String subject, List<String> violations) {
        super(ErrorKind.CONFIGURATION_INVALID, subject + ": " + String.join("; ", violations),
                subject + ": " + String.join("; ", violations), null, null, null);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
