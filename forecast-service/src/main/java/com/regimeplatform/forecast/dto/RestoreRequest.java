package com.regimeplatform.forecast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code name} of a snapshot file; latest when absent. */
public record RestoreRequest(@JsonProperty("name") String name) {}
