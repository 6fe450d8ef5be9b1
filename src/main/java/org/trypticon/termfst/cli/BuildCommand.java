package org.trypticon.termfst.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.packed.PackedInts;
import org.trypticon.termfst.InfoStream;
import org.trypticon.termfst.PrintStreamInfoStream;
import org.trypticon.termfst.fst.Builder;
import org.trypticon.termfst.fst.FST;
import org.trypticon.termfst.fst.PositiveIntOutputs;
import org.trypticon.termfst.fst.Util;

/**
 * Command to build a term dictionary from a sorted list of terms and values.
 */
class BuildCommand extends Command {
    BuildCommand() {
        super("build", "Builds a term dictionary from a sorted term list",
                "<input> <output> [--pack] [--verbose]",
                "<input> is UTF-8 text with one <term><TAB><number> per line, sorted by",
                "the term's UTF-8 bytes. Numbers must be >= 0 and terms must not repeat.",
                "Empty lines are skipped.",
                "--pack     writes a packed dictionary, smaller but slower to build",
                "--verbose  prints build statistics to stderr");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        boolean pack = false;
        boolean verbose = false;
        List<String> paths = new ArrayList<>();
        for (String arg : args) {
            if (arg.equals("--pack")) {
                pack = true;
            } else if (arg.equals("--verbose")) {
                verbose = true;
            } else if (arg.startsWith("--")) {
                usage(err);
                return 1;
            } else {
                paths.add(arg);
            }
        }
        if (!checkArgumentCount(paths, 2, err)) {
            return 1;
        }

        Path input = Path.of(paths.get(0));
        Path output = Path.of(paths.get(1));
        InfoStream infoStream = verbose ? new PrintStreamInfoStream(err) : InfoStream.NO_OUTPUT;
        Builder<Long> builder = new Builder<>(FST.INPUT_TYPE.BYTE1, 0, 0, true, true, Integer.MAX_VALUE,
                PositiveIntOutputs.getSingleton(), pack, PackedInts.COMPACT, true, 15, infoStream);

        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            IntsRefBuilder scratch = new IntsRefBuilder();
            BytesRef lastTerm = null;
            int lineNumber = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    continue;
                }
                int tab = line.lastIndexOf('\t');
                if (tab < 0) {
                    err.println("Line " + lineNumber + ": expected <term><TAB><number>");
                    return 1;
                }
                BytesRef term = new BytesRef(line.substring(0, tab));
                long value;
                try {
                    value = Long.parseLong(line.substring(tab + 1));
                } catch (NumberFormatException e) {
                    err.println("Line " + lineNumber + ": not a number: " + line.substring(tab + 1));
                    return 1;
                }
                if (value < 0) {
                    err.println("Line " + lineNumber + ": negative value: " + value);
                    return 1;
                }
                if (lastTerm != null) {
                    int cmp = term.compareTo(lastTerm);
                    if (cmp == 0) {
                        err.println("Line " + lineNumber + ": duplicate term: " + term.utf8ToString());
                        return 1;
                    } else if (cmp < 0) {
                        err.println("Line " + lineNumber + ": term out of order: " + term.utf8ToString());
                        return 1;
                    }
                }
                builder.add(Util.toIntsRef(term, scratch), value);
                lastTerm = term;
            }

            FST<Long> fst = builder.finish();
            fst.save(output);
            out.println("Built " + builder.getTermCount() + " terms into " + output);
            return 0;
        } catch (IOException e) {
            return fail(err, "Error building term dictionary from: " + input, e);
        }
    }
}
