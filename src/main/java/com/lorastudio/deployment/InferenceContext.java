package com.lorastudio.deployment;

import java.util.List;

public record InferenceContext(Deployment deployment, List<GroundingSnippet> snippets) {
    public InferenceContext {
        snippets = snippets == null ? List.of() : List.copyOf(snippets);
    }
}
