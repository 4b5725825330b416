package com.lorastudio.training;

import java.io.IOException;
import java.nio.file.Path;

public interface ExecutionBackend {
    Result execute(ExecutionRequest request, ProgressSink progress) throws IOException, InterruptedException;

    String name();

    @FunctionalInterface
    interface ProgressSink {
        /**
         * @param fraction completed share of training in [0, 1]
         * @return false when the run was cancelled or timed out and the backend should stop
         */
        boolean report(double fraction);
    }

    record Result(
            boolean succeeded,
            boolean cancelled,
            boolean retryable,
            Path checkpointPath,
            Path adapterPath,
            Double trainLoss,
            int steps,
            String error) {

        public static Result succeeded(Path checkpointPath, Path adapterPath, Double trainLoss, int steps) {
            return new Result(true, false, false, checkpointPath, adapterPath, trainLoss, steps, null);
        }

        public static Result failed(String error, boolean retryable) {
            return new Result(false, false, retryable, null, null, null, 0, error);
        }

        public static Result cancelled(int steps) {
            return new Result(false, true, false, null, null, null, steps, "Stopped before completion");
        }
    }
}
