package org.daag.deid.gateway;

/**
 * config properties needed by both join and clean runs
 */
public enum ProcessingConfigProperty implements ConfigService.ConfigProperty {

    /**
     * secret salt keying the pseudonyms; whoever holds it can reverse them
     */
    PSEUDONYMIZATION_SALT,
}
