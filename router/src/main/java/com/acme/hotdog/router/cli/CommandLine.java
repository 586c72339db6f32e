package com.acme.hotdog.router.cli;

import com.acme.hotdog.router.util.RouterDefaults;

import java.nio.file.Path;

/**
 * Parsed arguments: {@code [-c|--config FILE] [-t|--test FILE]}.
 *
 * @param config   configuration document
 * @param testFile lines to check against the rules, or null to run the daemon
 */
record CommandLine(Path config, Path testFile) {

    static CommandLine parse(String... args) {
        Path config = Path.of(RouterDefaults.DEFAULT_CONFIG_FILE);
        Path test = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-c", "--config" -> config = Path.of(value(args, ++i, arg));
                case "-t", "--test" -> test = Path.of(value(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--config=")) {
                        config = Path.of(arg.substring("--config=".length()));
                    } else if (arg.startsWith("--test=")) {
                        test = Path.of(arg.substring("--test=".length()));
                    } else {
                        throw new IllegalArgumentException("unknown argument: " + arg);
                    }
                }
            }
        }
        return new CommandLine(config, test);
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].isBlank()) {
            throw new IllegalArgumentException(flag + " requires a file argument");
        }
        return args[index];
    }

    boolean testMode() {
        return testFile != null;
    }

    static String usage() {
        return "usage: hotdog [-c|--config FILE] [-t|--test FILE]";
    }
}
