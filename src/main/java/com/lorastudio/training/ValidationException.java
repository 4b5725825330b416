package com.lorastudio.training;

import com.lorastudio.PipelineException;

public class ValidationException extends PipelineException {
    public ValidationException(String message) {
        super(message);
    }
}
