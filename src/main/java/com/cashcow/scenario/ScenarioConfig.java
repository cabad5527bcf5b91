package com.cashcow.scenario;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the ScenarioManager under the {@code cashcow.scenarios} prefix.
 *
 * <ul>
 *   <li>{@code directory} -- directory of scenario YAML files loaded at startup; unset loads none</li>
 *   <li>{@code createDefaults} -- register the built-in baseline, optimistic, conservative and
 *       cash_preservation scenarios</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "cashcow.scenarios")
public class ScenarioConfig {

    private String directory;
    private boolean createDefaults = true;
}
