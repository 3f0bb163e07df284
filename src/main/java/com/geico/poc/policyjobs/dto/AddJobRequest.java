package com.geico.poc.policyjobs.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public class AddJobRequest {

    private String proc;

    @JsonProperty("schedule_interval")
    private String scheduleInterval;

    private JsonNode config;

    @JsonProperty("initial_start")
    private String initialStart;

    private Boolean scheduled;

    public AddJobRequest() {
    }

    public String getProc() {
        return proc;
    }

    public void setProc(String proc) {
        this.proc = proc;
    }

    public String getScheduleInterval() {
        return scheduleInterval;
    }

    public void setScheduleInterval(String scheduleInterval) {
        this.scheduleInterval = scheduleInterval;
    }

    public JsonNode getConfig() {
        return config;
    }

    public void setConfig(JsonNode config) {
        this.config = config;
    }

    public String getInitialStart() {
        return initialStart;
    }

    public void setInitialStart(String initialStart) {
        this.initialStart = initialStart;
    }

    public Boolean getScheduled() {
        return scheduled;
    }

    public void setScheduled(Boolean scheduled) {
        this.scheduled = scheduled;
    }
}
