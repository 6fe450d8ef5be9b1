package org.trypticon.termfst;

/**
 * Sink for diagnostic messages produced while building and packing FSTs.
 * Callers check {@link #isEnabled(String)} before formatting a message.
 */
public interface InfoStream {

    /**
     * An info stream which logs to nowhere.
     */
    InfoStream NO_OUTPUT = new InfoStream() {
        @Override
        public void message(String component, String line) {
            // discarded
        }

        @Override
        public boolean isEnabled(String component) {
            return false;
        }
    };

    /**
     * Logs a message for a component.
     *
     * @param component the component name, e.g. {@code "FST"}.
     * @param line the message line.
     */
    void message(String component, String line);

    /**
     * Tests whether a message for a given component will be logged.
     *
     * @param component the component name.
     * @return {@code true} if messages for that component will be logged.
     */
    boolean isEnabled(String component);
}
