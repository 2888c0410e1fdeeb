package io.reviewmind.app;

import io.reviewmind.cli.CliContext;
import io.reviewmind.cli.IngestCommand;
import io.reviewmind.cli.InitCommand;
import io.reviewmind.cli.ReviewCommand;
import io.reviewmind.cli.ReviewMindCliCommand;
import io.reviewmind.cli.StatsCommand;
import io.reviewmind.cli.StatusCommand;
import io.reviewmind.core.config.ConfigPaths;
import io.reviewmind.core.config.ConfigService;
import picocli.CommandLine;

public final class ReviewMindApplication {

    private ReviewMindApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(
            new ConfigService(),
            ConfigPaths.defaultConfigPath(),
            System.getenv(),
            new ProviderComponents()
        );

        CommandLine commandLine = new CommandLine(new ReviewMindCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("ingest", new IngestCommand(context));
        commandLine.addSubcommand("review", new ReviewCommand(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
