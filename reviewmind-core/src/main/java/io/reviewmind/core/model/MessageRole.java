package io.reviewmind.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
