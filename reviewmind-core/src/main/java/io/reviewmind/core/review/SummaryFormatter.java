package io.reviewmind.core.review;

public final class SummaryFormatter {

    public String format(int memorySize, int chunksAnalyzed, int chunksWithMatches, int suggestions) {
        return "## 🤖 Auto-Review Summary\n\n"
            + "I've analyzed this PR using **" + memorySize + " past reviews** from our team's memory and posted **"
            + suggestions + " suggestions** based on similar code patterns.\n\n"
            + "### Analysis Results:\n"
            + "- **Code chunks analyzed:** " + chunksAnalyzed + "\n"
            + "- **Chunks with similar past reviews:** " + chunksWithMatches + "\n"
            + "- **Review comments generated:** " + suggestions + "\n\n"
            + "The suggestions above are based on patterns from previous code reviews. "
            + "Please review them critically and ignore them if they do not apply to your change.\n\n"
            + "---\n"
            + "*This auto-review learns from the team's review history to keep feedback consistent. "
            + "It supplements human review and does not replace it.*";
    }
}
