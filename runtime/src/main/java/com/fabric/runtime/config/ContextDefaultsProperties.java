package com.fabric.runtime.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code runtime.context.defaults.*}: lowest-precedence values handlers resolve after intent
 * parameters and session context.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "runtime.context")
public class ContextDefaultsProperties {

    private Map<String, String> defaults = new LinkedHashMap<>();
}
