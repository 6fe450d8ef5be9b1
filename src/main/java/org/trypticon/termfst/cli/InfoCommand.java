package org.trypticon.termfst.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import org.trypticon.termfst.fst.FST;

/**
 * Command to show info about a term dictionary.
 */
class InfoCommand extends Command {
    InfoCommand() {
        super("info", "Gives info about a term dictionary", "<fst>");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (!checkArgumentCount(args, 1, err)) {
            return 1;
        }
        Path file = Path.of(args.get(0));
        try {
            FST<Long> fst = readDictionary(file);
            out.println("Packed: " + fst.isPacked());
            out.println("Input type: " + fst.getInputType());
            out.println("Nodes: " + fst.getNodeCount());
            out.println("Arcs: " + fst.getArcCount());
            out.println("Arcs with output: " + fst.getArcWithOutputCount());
            out.println("Body size: " + fst.sizeInBytes() + " bytes");
            out.println("Accepts empty term: " + (fst.getEmptyOutput() != null));
            return 0;
        } catch (IOException e) {
            return fail(err, "Error reading term dictionary at: " + file, e);
        }
    }
}
