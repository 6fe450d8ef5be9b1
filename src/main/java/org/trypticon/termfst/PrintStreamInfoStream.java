package org.trypticon.termfst;

import java.io.PrintStream;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nonnull;

/**
 * Info stream writing every component's messages to a print stream,
 * prefixed with the component name and the time since creation.
 */
public class PrintStreamInfoStream implements InfoStream {
    private final PrintStream stream;
    private final long startNanos = System.nanoTime();

    /**
     * Constructs the info stream.
     *
     * @param stream the stream to print messages to.
     */
    public PrintStreamInfoStream(@Nonnull PrintStream stream) {
        this.stream = stream;
    }

    @Override
    public void message(String component, String line) {
        long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        stream.println(component + " " + millis + "ms: " + line);
    }

    @Override
    public boolean isEnabled(String component) {
        return true;
    }
}
