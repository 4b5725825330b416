package com.lorastudio.tenant;

import com.lorastudio.PipelineException;

public class AccessDeniedException extends PipelineException {
    public AccessDeniedException(String message) {
        super(message);
    }
}
