package com.lorastudio.deployment;

import com.lorastudio.PipelineException;

public class NoActiveDeploymentException extends PipelineException {
    public NoActiveDeploymentException(String message) {
        super(message);
    }
}
