package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /runners/{id}/heartbeat}. A non-null model list replaces
 * the models the runner advertises.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunnerHeartbeat {

    @JsonProperty("current_load")
    private int currentLoad;

    private List<RunnerRegistration.Model> models;

    public int getCurrentLoad() { return currentLoad; }
    public void setCurrentLoad(int currentLoad) { this.currentLoad = currentLoad; }

    public List<RunnerRegistration.Model> getModels() { return models; }
    public void setModels(List<RunnerRegistration.Model> models) { this.models = models; }
}
