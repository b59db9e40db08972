package com.wakeengine.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RealTimeToggleRequest(
    @JsonProperty("enabled") boolean enabled
) {}
