package org.trypticon.termfst.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.trypticon.termfst.fst.FST;
import org.trypticon.termfst.fst.PositiveIntOutputs;

/**
 * Base class for CLI commands. Each command knows its own argument syntax and
 * any extra notes {@code help} should show for it.
 */
abstract class Command {
    private final String name;
    private final String description;
    private final String arguments;
    private final List<String> notes;

    /**
     * Constructs the command.
     *
     * @param name a short name for the command.
     * @param description a one-line description of the command.
     * @param arguments the argument syntax, printed after the command name.
     * @param notes extra lines shown by {@code help}, such as input formats or exit codes.
     */
    protected Command(String name, String description, String arguments, String... notes) {
        this.name = name;
        this.description = description;
        this.arguments = arguments;
        this.notes = Arrays.asList(notes);
    }

    /**
     * Gets the name of the command.
     *
     * @return the name of the command.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets a one-line description of the command.
     *
     * @return the description.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Prints the argument syntax for this command.
     *
     * @param err the error stream.
     */
    void usage(PrintStream err) {
        err.println("usage: " + Constants.APP_NAME + " " + name + " " + arguments);
    }

    /**
     * Prints the full help for this command: description, syntax and notes.
     *
     * @param err the error stream.
     */
    void help(PrintStream err) {
        err.println(Constants.APP_NAME + " " + name + " - " + description);
        usage(err);
        if (!notes.isEmpty()) {
            err.println();
            for (String note : notes) {
                err.println("  " + note);
            }
        }
    }

    /**
     * Runs the command.
     *
     * @param args the arguments to the command.
     * @param out the output stream.
     * @param err the error stream.
     * @return the exit code of the command.
     */
    abstract int run(List<String> args, PrintStream out, PrintStream err);

    /**
     * Checks the argument count, printing usage when it is wrong.
     *
     * @param args the arguments given.
     * @param expected the number of arguments the command takes.
     * @param err the error stream.
     * @return {@code true} if the count matched.
     */
    boolean checkArgumentCount(List<String> args, int expected, PrintStream err) {
        if (args.size() != expected) {
            usage(err);
            return false;
        }
        return true;
    }

    /**
     * Reads a term dictionary written by {@code build}.
     *
     * @param file the dictionary file.
     * @return the dictionary.
     * @throws IOException if the file could not be read or is not a term dictionary.
     */
    static FST<Long> readDictionary(Path file) throws IOException {
        return FST.read(file, PositiveIntOutputs.getSingleton());
    }

    /**
     * Reports a failure: the message, then one line per exception in the cause chain.
     *
     * @param err the error stream.
     * @param message what was being done when it failed.
     * @param e the exception.
     * @return the exit code for a failed command.
     */
    static int fail(PrintStream err, String message, Exception e) {
        err.println(message);
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            err.println(cause);
        }
        return 1;
    }
}
