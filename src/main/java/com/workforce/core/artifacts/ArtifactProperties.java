package com.workforce.core.artifacts;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "workforce.artifacts")
public class ArtifactProperties {

    private boolean enabled = true;
    private String baseDir = Path.of(System.getProperty("java.io.tmpdir"), "workforce-runs").toString();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }
}
