package com.scriptohio.orchestrator.client;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Prediction {
    private String modelId;
    private double value;

    // null when the model does not report one
    private Double confidence;
}
