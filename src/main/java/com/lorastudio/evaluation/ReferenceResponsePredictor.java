package com.lorastudio.evaluation;

import java.nio.file.Path;
import java.util.Arrays;

import com.lorastudio.dataset.HeldOutExample;

public class ReferenceResponsePredictor implements ResponsePredictor {
    static final String REFUSAL = "I do not have enough grounded information to answer safely. Escalate to a manager.";
    private static final int MAX_WORDS = 50;

    @Override
    public String predict(Path checkpointPath, HeldOutExample example) {
        if (example.expectedRefusal()) {
            return REFUSAL;
        }
        String[] words = example.output().strip().split("\\s+");
        if (words.length > MAX_WORDS) {
            return String.join(" ", Arrays.copyOfRange(words, 0, MAX_WORDS));
        }
        return example.output();
    }
}
