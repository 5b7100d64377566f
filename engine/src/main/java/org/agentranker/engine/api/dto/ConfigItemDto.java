package org.agentranker.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for one scoring configuration entry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ConfigItemDto {

    @JsonProperty("key")
    private String key;

    @JsonProperty("value")
    private Double value;

    @JsonProperty("description")
    private String description;

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
