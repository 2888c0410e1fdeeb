package io.reviewmind.core.suggestion;

public record Provenance(String author, double score) {
}
