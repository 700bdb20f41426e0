package org.daag.deid.gateway;

import org.daag.deid.core.InvalidConfigurationException;

import java.util.Optional;

public interface ConfigService {

    interface ConfigProperty {
        String name();
    }

    /**
     * @param property to retrieve
     * @return value of property
     * @throws InvalidConfigurationException if property isn't set
     */
    default String getConfigPropertyOrError(ConfigProperty property) {
        return getConfigPropertyAsOptional(property)
            .orElseThrow(() -> new InvalidConfigurationException("Missing config. no value for " + property.name()));
    }

    Optional<String> getConfigPropertyAsOptional(ConfigProperty property);
}
