package uk.co.farowl.cfront;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import uk.co.farowl.cfront.CFrontCompiler.CFrontErrors;
import uk.co.farowl.cfront.ast.ConstructionError;

/**
 * The front end as it may be invoked at the command prompt, and its main program. This is a
 * wrapper around {@link CFrontCompiler} that sets options from the command line.
 */
public class Compile {

    /**
     * Main program. For usage instructions invoke as:
     *
     * <pre>
     * java -cp ... uk.co.farowl.cfront.Compile -h
     * </pre>
     *
     * @param args command line
     */
    public static void main(String[] args) {

        // Parse the command line
        Compile.Options options = new Compile.Options(args);

        // Help if asked (or if there was an error).
        if (options.commandLineError != null) {
            options.giveHelp();
            System.err.println(options.commandLineError);
            System.exit(1);

        } else if (options.giveHelp) {
            options.giveHelp();

        } else {
            // Options ok apparently. Let's get on with it.
            try {
                compileMain(options);
            } catch (Exception e) {
                System.err.println("Error: " + e);
            }
        }
    }

    /**
     * Implements the main action once it is known there is no error, and we're actually going to
     * compile some source (not just print the usage message).
     */
    private static void compileMain(Compile.Options options)
            throws IOException, CFrontErrors, ConstructionError {

        // Create an instance of the compiler to use, then configure it from the options.
        CFrontCompiler compiler = new CFrontCompiler();
        compiler.setOutputDirectory(Paths.get(options.outputDir));
        compiler.setOutputNameFormat(options.outputNameFormat);
        compiler.setShowLevels(options.showLevels);

        Path source = Paths.get(options.inputName);
        compiler.compile(source);
    }

    /** The command line, parsed. */
    static class Options {

        /** If not null, there was an error and this is the description. */
        String commandLineError;
        /** -h present: give usage/help message. Also set on detection of usage errors. */
        boolean giveHelp;
        /** -l present: list the tree by level. */
        boolean showLevels;
        /** Name of the input file to read. */
        String inputName;
        /** Name of the output directory to write. */
        String outputDir = "";
        /** Format of the output file name. */
        String outputNameFormat = CFrontCompiler.DEFAULT_OUTPUT_NAME_FORMAT;
        /** Arguments to parse. */
        final String[] args;
        /** Index to unprocessed argument. */
        int argp = 0;

        /** Construct from command-line arguments. */
        Options(String[] args) {
            this.args = args;
            parseCommand();
        }

        /** Parse command arguments to local variables. */
        private void parseCommand() {
            while (!error() && argp < args.length) {
                String arg = args[argp++];
                if (arg.length() >= 2 && arg.charAt(0) == '-') {
                    // It's a switch
                    switch (arg) {
                        case "-h":
                            giveHelp = true;
                            break;
                        case "-d":
                            outputDir = argValue("output directory");
                            break;
                        case "-f":
                            outputNameFormat = argValue("file name format");
                            break;
                        case "-l":
                            showLevels = true;
                            break;
                        default:
                            setError("Unknown option: " + arg);
                            break;
                    }
                } else {
                    // It's a file
                    if (inputName == null) {
                        inputName = arg;
                    } else {
                        setError("Spurious file name: " + arg);
                    }
                }
            }

            // Consistency checks
            if (!giveHelp && !error()) {
                if (inputName == null) {
                    setError("Must specify <infile>.");
                } else if (!outputNameFormat.contains("%s")) {
                    setError("Output name format must contain %s: " + outputNameFormat);
                }
            }

            // If there was an error, give help unasked.
            giveHelp |= error();
        }

        /** Process value associated with argument. */
        String argValue(String purpose) {
            if (argp < args.length) {
                return args[argp++];
            } else {
                setError(args[argp - 1] + " missing " + purpose);
                return null;
            }
        }

        /** Declare there was an error, but do not overwrite existing error. */
        void setError(String msg) {
            if (!error() && msg != null) {
                commandLineError = msg;
            }
        }

        /** True iff an error has been declared. */
        boolean error() {
            return commandLineError != null;
        }

        void giveHelp() {
            System.out.println("Arguments:");
            System.out.println(" ...  [-h] [-d <outdir>] [-f <format>] [-l] <infile>");
            System.out.println("-h  Output this help and stop");
            System.out.println("-d  Destination directory for the preorder text");
            System.out.println("-f  Output name format (default \"%s.ast\")");
            System.out.println("-l  Also list the tree one node per line by level");
            System.out.println("Option -h cancels compilation.");
        }
    }
}
