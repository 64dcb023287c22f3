package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.inference.gateway.domain.model.ServedModel;

import java.util.List;

/**
 * Body of {@code POST /runners/register}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunnerRegistration {

    @JsonProperty("runner_id")
    private String runnerId;

    @JsonProperty("base_url")
    private String baseUrl;

    @JsonProperty("protocol_version")
    private int protocolVersion;

    private List<Model> models;

    public String getRunnerId() { return runnerId; }
    public void setRunnerId(String runnerId) { this.runnerId = runnerId; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public int getProtocolVersion() { return protocolVersion; }
    public void setProtocolVersion(int protocolVersion) { this.protocolVersion = protocolVersion; }

    public List<Model> getModels() { return models; }
    public void setModels(List<Model> models) { this.models = models; }

    /**
     * Converts the advertised models.
     *
     * @throws IllegalArgumentException if a model is malformed
     */
    public List<ServedModel> toServedModels() {
        if (models == null) {
            return List.of();
        }
        return models.stream().map(Model::toServedModel).toList();
    }

    /**
     * A model advertised by a runner.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Model {
        @JsonProperty("model_id")
        private String modelId;

        @JsonProperty("max_batch_size")
        private int maxBatchSize = 1;

        @JsonProperty("engine_type")
        private String engineType;

        @JsonProperty("local_name")
        private String localName;

        public Model() {
        }

        public Model(String modelId, int maxBatchSize) {
            this.modelId = modelId;
            this.maxBatchSize = maxBatchSize;
        }

        public String getModelId() { return modelId; }
        public void setModelId(String modelId) { this.modelId = modelId; }

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }

        public String getEngineType() { return engineType; }
        public void setEngineType(String engineType) { this.engineType = engineType; }

        public String getLocalName() { return localName; }
        public void setLocalName(String localName) { this.localName = localName; }

        public ServedModel toServedModel() {
            if (modelId == null) {
                throw new IllegalArgumentException("model_id is required");
            }
            return new ServedModel(modelId, maxBatchSize, engineType, localName);
        }
    }
}
