package org.daag.deid.gateway;

import com.google.common.annotations.VisibleForTesting;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Optional;

/**
 * config from process environment; property name is the variable name
 */
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PACKAGE) //for tests
public class EnvVarsConfigService implements ConfigService {

    @VisibleForTesting
    Map<String, String> environment = System.getenv();

    @Override
    public Optional<String> getConfigPropertyAsOptional(ConfigProperty property) {
        // blank is treated as unset; shells make it too easy to export an empty value
        return Optional.ofNullable(environment.get(property.name()))
            .filter(StringUtils::isNotBlank);
    }
}
