package io.reviewmind.core.ingest;

import io.reviewmind.core.config.model.TaggingConfig;
import io.reviewmind.core.config.model.TaggingConfig.TagRule;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class CommentTagger {
    private final String defaultTag;
    private final List<TagRule> rules;

    public CommentTagger(TaggingConfig config) {
        TaggingConfig effective = config == null ? TaggingConfig.defaults() : config;
        this.defaultTag = effective.defaultTag() == null || effective.defaultTag().isBlank()
            ? "general"
            : effective.defaultTag().trim();
        this.rules = effective.rules();
    }

    /**
     * Tags whose keywords occur in {@code comment}, in rule order; the default tag when none match.
     */
    public Set<String> tag(String comment) {
        String lower = comment == null ? "" : comment.toLowerCase(Locale.ROOT);
        Set<String> tags = new LinkedHashSet<>();
        for (TagRule rule : rules) {
            for (String keyword : rule.keywords()) {
                if (!keyword.isBlank() && lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                    tags.add(rule.tag());
                    break;
                }
            }
        }
        if (tags.isEmpty()) {
            tags.add(defaultTag);
        }
        return tags;
    }
}
