package io.reviewmind.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Keyword table used to tag review comments. Rules are matched in order against the
 * lower-cased comment text; a comment matching no rule gets {@code defaultTag}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaggingConfig(
    @JsonAlias({"default_tag"}) String defaultTag,
    List<TagRule> rules
) {
    public TaggingConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static TaggingConfig defaults() {
        return new TaggingConfig(
            "general",
            List.of(
                new TagRule("security", List.of("security", "vulnerable", "injection", "xss", "csrf")),
                new TagRule("performance", List.of("performance", "perf", "slow", "optimize", "memory", "cpu")),
                new TagRule("validation", List.of("null", "validate", "validation", "check")),
                new TagRule("style", List.of("style", "format", "naming", "convention")),
                new TagRule("architecture", List.of("architecture", "design", "pattern", "structure")),
                new TagRule("testing", List.of("test", "coverage", "mock", "assertion")),
                new TagRule("documentation", List.of("document", "comment", "javadoc", "readme"))
            )
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TagRule(String tag, List<String> keywords) {
        public TagRule {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }
    }
}
