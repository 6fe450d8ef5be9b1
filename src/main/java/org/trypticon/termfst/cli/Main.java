package org.trypticon.termfst.cli;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Entry point for the {@code termfst} tool, which builds, inspects and queries
 * term dictionaries.
 */
public class Main {
    /**
     * Runs the tool and exits with the command's exit code.
     *
     * @param args the command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(new Main().run(Arrays.asList(args), System.out, System.err));
    }

    /**
     * Dispatches to the command named by the first argument.
     *
     * @param args the command-line arguments.
     * @param out the output stream, for command results.
     * @param err the error stream, for usage and diagnostics.
     * @return 0 on success, 1 on a usage error, a failed command or a term not found.
     */
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (args.isEmpty()) {
            usage(err);
            return 1;
        }
        if (args.get(0).equals("-h") || args.get(0).equals("--help")) {
            usage(err);
            return 0;
        }

        Command command = Commands.findCommand(args.get(0));
        if (command == null) {
            Commands.unknownCommand(err, args.get(0));
            return 1;
        }
        return command.run(args.subList(1, args.size()), out, err);
    }

    private static void usage(PrintStream err) {
        err.println("usage: " + Constants.APP_NAME + " <command> <args...>");
        err.println("Builds term dictionaries from sorted term lists and looks terms up in them.");
        Commands.availableCommands(err);
        err.println("Use " + Constants.APP_NAME + " help <command> for help on a specific command.");
    }
}
