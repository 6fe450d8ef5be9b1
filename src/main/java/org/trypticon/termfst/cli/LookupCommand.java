package org.trypticon.termfst.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import org.apache.lucene.util.BytesRef;
import org.trypticon.termfst.fst.FST;
import org.trypticon.termfst.fst.Util;

/**
 * Command to look up the value of a single term.
 */
class LookupCommand extends Command {
    LookupCommand() {
        super("lookup", "Looks up the value stored for a term", "<fst> <term>",
                "Prints <term><TAB><value> when the term is present.",
                "Exits with 1 and prints nothing to stdout when it is not.");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (!checkArgumentCount(args, 2, err)) {
            return 1;
        }
        Path file = Path.of(args.get(0));
        String term = args.get(1);
        try {
            FST<Long> fst = readDictionary(file);
            if (fst.getInputType() != FST.INPUT_TYPE.BYTE1) {
                err.println("Term dictionary at " + file + " has " + fst.getInputType()
                        + " labels; only BYTE1 can be looked up");
                return 1;
            }
            Long value = Util.get(fst, new BytesRef(term));
            if (value == null) {
                err.println("Term not found: " + term);
                return 1;
            }
            out.println(term + "\t" + value);
            return 0;
        } catch (IOException e) {
            return fail(err, "Error reading term dictionary at: " + file, e);
        }
    }
}
