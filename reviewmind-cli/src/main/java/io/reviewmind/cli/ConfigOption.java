package io.reviewmind.cli;

import java.nio.file.Path;
import picocli.CommandLine.Option;

public final class ConfigOption {

    @Option(names = {"-c", "--config"}, description = "Config file (default: ~/.reviewmind/config.json)")
    Path path;
}
