package de.bsommerfeld.canvas.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class UpdateConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://canvas.019890311.xyz";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
}
