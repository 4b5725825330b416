package com.lorastudio.evaluation;

import java.nio.file.Path;

import com.lorastudio.dataset.HeldOutExample;

@FunctionalInterface
public interface ResponsePredictor {
    String predict(Path checkpointPath, HeldOutExample example);
}
