package com.lorastudio.deployment;

public interface InferenceBackend {
    Generation generate(String prompt, InferenceContext context);

    record Generation(String text, String backend, boolean fallback) {
    }
}
