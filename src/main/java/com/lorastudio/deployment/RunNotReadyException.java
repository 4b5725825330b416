package com.lorastudio.deployment;

import com.lorastudio.PipelineException;

public class RunNotReadyException extends PipelineException {
    public RunNotReadyException(String message) {
        super(message);
    }
}
