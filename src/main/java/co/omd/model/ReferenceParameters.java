package co.omd.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** UVR e inflación usados en una corrida. */
public record ReferenceParameters(
    @JsonProperty("uvr")             double indexSpot,
    @JsonProperty("inflacion")       double annualInflation,
    @JsonProperty("uvr_fin_periodo") double indexForward
) {}
