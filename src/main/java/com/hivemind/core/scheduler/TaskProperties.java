package com.hivemind.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "hivemind.tasks")
public class TaskProperties {

    /** Agent id allowed to perform any transition. */
    private String plannerId = "orchestrator";

    public String getPlannerId() {
        return plannerId;
    }

    public void setPlannerId(String plannerId) {
        this.plannerId = plannerId;
    }
}
