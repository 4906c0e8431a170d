package com.ureca.mimus.config;

import com.ureca.mimus.statement.ValidationMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "mimus.statement")
public record StatementProperties(
        @DefaultValue("PASS_THROUGH") ValidationMode validationMode
) {
}
