package com.lorastudio.deployment;

import com.lorastudio.PipelineException;

public class DuplicateVersionException extends PipelineException {
    public DuplicateVersionException(String message) {
        super(message);
    }
}
