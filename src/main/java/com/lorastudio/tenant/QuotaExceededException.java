package com.lorastudio.tenant;

import com.lorastudio.PipelineException;

public class QuotaExceededException extends PipelineException {
    public QuotaExceededException(String message) {
        super(message);
    }
}
