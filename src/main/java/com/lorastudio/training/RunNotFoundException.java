package com.lorastudio.training;

import com.lorastudio.PipelineException;

public class RunNotFoundException extends PipelineException {
    public RunNotFoundException(String runId) {
        super("Training run not found: " + runId);
    }
}
