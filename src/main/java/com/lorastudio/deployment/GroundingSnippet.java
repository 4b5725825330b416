package com.lorastudio.deployment;

public record GroundingSnippet(String snippetId, String documentId, String text, double score) {
}
