package io.reviewmind.cli;

import picocli.CommandLine.Command;

@Command(
    name = "reviewmind",
    mixinStandardHelpOptions = true,
    description = "Suggests review comments for new changes from the team's past reviews"
)
public final class ReviewMindCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
