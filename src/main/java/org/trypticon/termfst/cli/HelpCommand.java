package org.trypticon.termfst.cli;

import java.io.PrintStream;
import java.util.List;

/**
 * Command to show help on other commands. With no argument it lists them.
 */
class HelpCommand extends Command {
    HelpCommand() {
        super("help", "Prints help for a command", "[<command>]");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (args.isEmpty()) {
            Commands.availableCommands(err);
            return 0;
        }
        if (!checkArgumentCount(args, 1, err)) {
            return 1;
        }
        Command command = Commands.findCommand(args.get(0));
        if (command == null) {
            Commands.unknownCommand(err, args.get(0));
            return 1;
        }
        command.help(err);
        return 0;
    }
}
