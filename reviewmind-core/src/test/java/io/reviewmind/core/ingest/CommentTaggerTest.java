package io.reviewmind.core.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import io.reviewmind.core.config.model.TaggingConfig;
import io.reviewmind.core.config.model.TaggingConfig.TagRule;
import java.util.List;
import org.junit.jupiter.api.Test;

class CommentTaggerTest {

    @Test
    void shouldTagByKeywordsCaseInsensitively() {
        CommentTagger tagger = new CommentTagger(TaggingConfig.defaults());

        assertThat(tagger.tag("Possible SQL Injection here, and a NULL check is missing"))
            .containsExactly("security", "validation");
        assertThat(tagger.tag("This loop is slow")).containsExactly("performance");
    }

    @Test
    void shouldFallBackToDefaultTag() {
        CommentTagger tagger = new CommentTagger(TaggingConfig.defaults());

        assertThat(tagger.tag("LGTM")).containsExactly("general");
        assertThat(tagger.tag(null)).containsExactly("general");
    }

    @Test
    void shouldUseConfiguredRules() {
        CommentTagger tagger = new CommentTagger(new TaggingConfig("misc", List.of(new TagRule("logging", List.of("log")))));

        assertThat(tagger.tag("Use the LOGGER")).containsExactly("logging");
        assertThat(tagger.tag("rename this")).containsExactly("misc");
    }
}
