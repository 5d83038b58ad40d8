package com.phillippitts.mathspeech.config.properties;

import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Where rule files are loaded from at startup.
 */
@ConfigurationProperties(prefix = "mathspeech.rules")
@Validated
public class RuleProperties {

    /** Spring resource patterns of YAML rule files. */
    @NotEmpty(message = "At least one rule location is required")
    private List<String> locations = new ArrayList<>(List.of("classpath*:rules/*.yaml"));

    public List<String> getLocations() {
        return locations;
    }

    public void setLocations(List<String> locations) {
        this.locations = locations;
    }
}
