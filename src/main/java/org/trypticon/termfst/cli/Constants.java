package org.trypticon.termfst.cli;

/**
 * Constants shared by the command line front end.
 */
class Constants {
    /**
     * The name the tool is invoked as, used in usage messages.
     */
    static final String APP_NAME = "termfst";

    private Constants() {
    }
}
