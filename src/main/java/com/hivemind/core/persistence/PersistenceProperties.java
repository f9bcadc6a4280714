package com.hivemind.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "hivemind.persistence")
public class PersistenceProperties {

    /** Base directory for mission history and lessons. */
    private String dir = Path.of(System.getProperty("user.home"), ".hivemind").toString();

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public Path historyDir() {
        return Path.of(dir, "history");
    }

    public Path lessonsFile() {
        return Path.of(dir, "memory", "memories.json");
    }
}
