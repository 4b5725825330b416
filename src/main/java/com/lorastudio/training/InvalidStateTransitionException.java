package com.lorastudio.training;

import com.lorastudio.PipelineException;

public class InvalidStateTransitionException extends PipelineException {
    public InvalidStateTransitionException(String runId, RunState from, String attempted) {
        super("Run " + runId + " in state " + from + " cannot " + attempted);
    }
}
