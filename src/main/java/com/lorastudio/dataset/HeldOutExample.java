package com.lorastudio.dataset;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HeldOutExample(
        String id,
        String instruction,
        String output,
        @JsonProperty("expected_refusal") boolean expectedRefusal,
        String context) {

    public HeldOutExample {
        instruction = instruction == null ? "" : instruction;
        output = output == null ? "" : output;
        context = context == null ? "" : context;
    }
}
