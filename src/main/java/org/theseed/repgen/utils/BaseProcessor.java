/**
 *
 */
package org.theseed.repgen.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for all the commands.  A subclass declares its options and positional parameters
 * using args4j annotations and implements three methods.
 *
 * setDefaults		initialize the option fields to their default values
 * validateParms	check the parsed options and open input resources
 * runCommand		perform the command
 *
 * The base class supplies the following command-line options.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time of the command */
    private long startTime;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true, usage = "display command-line usage")
    private boolean helpMode;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "display more frequent log messages")
    private boolean debug;

    /**
     * Parse the command-line parameters.
     *
     * @param args	array of command-line parameters
     *
     * @return TRUE if the command is ready to run, else FALSE
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.helpMode = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.helpMode) {
                parser.printUsage(System.err);
            } else {
                this.setLogLevel();
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        } catch (IOException e) {
            System.err.println(e.toString());
        }
        return retVal;
    }

    /**
     * Adjust the root logging level according to the debug flag.
     */
    private void setLogLevel() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger)
            ((ch.qos.logback.classic.Logger) root).setLevel(this.debug ? Level.DEBUG : Level.INFO);
    }

    /**
     * Execute the command.  Any error is fatal.
     */
    public void run() {
        this.startTime = System.currentTimeMillis();
        try {
            this.runCommand();
            log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
        } catch (Exception e) {
            log.error("Command failed: {}", e.getMessage());
            throw new RuntimeException(e);
        }
    }

    /**
     * @return TRUE if debug mode was requested
     */
    public boolean isDebug() {
        return this.debug;
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options and open the input resources.
     *
     * @return TRUE if the command can run, else FALSE
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Run the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
