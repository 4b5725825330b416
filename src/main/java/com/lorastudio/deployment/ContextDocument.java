package com.lorastudio.deployment;

public record ContextDocument(String id, String text) {
}
