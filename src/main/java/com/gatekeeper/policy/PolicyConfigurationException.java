package com.gatekeeper.policy;

/**
 * Raised while the policy tables load: malformed rate strings, unknown algorithm
 * names, invalid tier limits. Startup is expected to fail with it.
 */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
