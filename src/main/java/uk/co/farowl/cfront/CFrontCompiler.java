package uk.co.farowl.cfront;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.cfront.ast.AstNode;
import uk.co.farowl.cfront.ast.ConstructionError;
import uk.co.farowl.cfront.ast.Serializer;
import uk.co.farowl.cfront.diag.DefaultErrorHandler;
import uk.co.farowl.cfront.parse.CFrontLexer;
import uk.co.farowl.cfront.parse.CFrontParser;
import uk.co.farowl.cfront.parse.CFrontParser.ProgramContext;
import uk.co.farowl.cfront.parse.ParseTreeReductionSource;
import uk.co.farowl.cfront.sema.SemanticAnalyzer;
import uk.co.farowl.cfront.symbol.SymbolReport;

/**
 * Front end for the toy C-like language. It parses a source file, runs the semantic actions over
 * the parse to build a symbol table and an abstract syntax tree, prints the symbol table and the
 * tree in preorder, and writes the preorder text to a file. Diagnostics are printed on the same
 * stream as they arise.
 */
public class CFrontCompiler {

    static final Logger logger = LoggerFactory.getLogger(CFrontCompiler.class);

    /** Default output filename pattern is {@code "%s.ast"}. */
    public static final String DEFAULT_OUTPUT_NAME_FORMAT = "%s.ast";

    /** Heading printed before the symbol table. */
    static final String SYMBOL_TABLE_HEADING = "Symbol Table";
    /** Heading printed before the preorder text. */
    static final String PREORDER_HEADING = "Preorder Traversal";

    private Path outputDirectory = Paths.get("");
    private String outputNameFormat = DEFAULT_OUTPUT_NAME_FORMAT;
    private boolean showLevels = false;
    private PrintStream out = System.out;

    /** Specify the directory to which the preorder text file is written. */
    public void setOutputDirectory(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /** The directory to which the preorder text file is written. */
    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Specify the file name to give the output as a format string applied to the source file name
     * without its extension (default "%s.ast").
     */
    public void setOutputNameFormat(String outputNameFormat) {
        this.outputNameFormat = outputNameFormat;
    }

    /** The format string giving the output file name. */
    public String getOutputNameFormat() {
        return outputNameFormat;
    }

    /** Specify whether to print the tree one node per line, indented by level. */
    public void setShowLevels(boolean showLevels) {
        this.showLevels = showLevels;
    }

    /** Specify the stream on which the results and diagnostics are printed. */
    public void setOut(PrintStream out) {
        this.out = out;
    }

    /** The outcome of compiling one source. */
    public static class Result {

        /** Root of the tree. */
        public final AstNode root;
        /** The symbol table at the end of the source. */
        public final SymbolReport symbols;
        /** Preorder text of the tree. */
        public final String preorder;
        /** Where the preorder text was written (or {@code null}). */
        public final Path outputFile;
        public final int errors;
        public final int warnings;

        Result(AstNode root, SymbolReport symbols, String preorder, Path outputFile, int errors,
                int warnings) {
            this.root = root;
            this.symbols = symbols;
            this.preorder = preorder;
            this.outputFile = outputFile;
            this.errors = errors;
            this.warnings = warnings;
        }
    }

    /**
     * Compile a source file using the current configuration, writing the preorder text to a file
     * in the output directory.
     *
     * @param source the file to compile
     * @return the outcome
     * @throws IOException on failure to read the source or write the output
     * @throws CFrontErrors if the source has syntax errors
     * @throws ConstructionError if the tree could not be built
     */
    public Result compile(Path source) throws IOException, CFrontErrors, ConstructionError {
        Path outputFile = outputDirectory.resolve(makeOutputFileName(source));
        logger.atInfo().setMessage("compiling {} to {}").addArgument(source)
                .addArgument(outputFile).log();
        return compile(CharStreams.fromPath(source, StandardCharsets.UTF_8), outputFile);
    }

    /**
     * Compile source text (an ANTLR stream), printing the results and, if a file is given,
     * writing the preorder text to it.
     *
     * @param input the source text
     * @param outputFile to receive the preorder text (or {@code null})
     * @return the outcome
     * @throws IOException on failure to write the output
     * @throws CFrontErrors if the source has syntax errors
     * @throws ConstructionError if the tree could not be built
     */
    public Result compile(CharStream input, Path outputFile)
            throws IOException, CFrontErrors, ConstructionError {

        // From the source, build a parse tree.
        ProgramContext parseTree = buildParseTree(input);

        // Run the semantic actions in the order of reduction.
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(out);
        SemanticAnalyzer analyzer = new SemanticAnalyzer(errorHandler);
        AstNode root;
        try {
            root = analyzer.analyze(new ParseTreeReductionSource(parseTree));
        } catch (ConstructionError ce) {
            // Still show what we know about the symbols.
            logger.atError().setMessage("tree construction failed: {}").addArgument(ce).log();
            printSymbols(analyzer.getSymbolTable().finish());
            throw ce;
        }

        SymbolReport symbols = analyzer.getSymbolTable().finish();
        printSymbols(symbols);

        // Second phase: levels and text of the finished tree.
        Serializer.computeDepth(root, 1);
        String preorder = Serializer.preorder(root);
        if (showLevels) {
            out.println();
            out.print(Serializer.levels(root));
        }
        out.println();
        out.println(PREORDER_HEADING);
        out.println(preorder);

        if (outputFile != null) {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer w = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
                w.write(preorder);
                w.write(System.lineSeparator());
            }
        }

        return new Result(root, symbols, preorder, outputFile,
                errorHandler.getNumberOfErrors(), errorHandler.getNumberOfWarnings());
    }

    private void printSymbols(SymbolReport symbols) {
        out.println();
        out.println(SYMBOL_TABLE_HEADING);
        out.println(symbols.render());
    }

    /** Remove ".c" (if any) and add ".ast" or whatever {@link #getOutputNameFormat()} says. */
    String makeOutputFileName(Path source) {
        Path fileOnly = source.getFileName();
        if (fileOnly == null) {
            throw new IllegalArgumentException("source file name is empty");
        }
        String name = fileOnly.toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return String.format(outputNameFormat, base);
    }

    /**
     * Thrown once by the parsing phase if there are any syntax errors. Each error is reported by
     * the parser on {@code System.err}.
     */
    public static class CFrontErrors extends Exception {

        private static final long serialVersionUID = 1L;

        protected final int errors;
        protected final String kind;
        protected final String sourceName;

        public CFrontErrors(String sourceName, String kind, int numberOfErrors) {
            this.sourceName = sourceName;
            this.kind = kind;
            this.errors = numberOfErrors;
        }

        /** @return the number of errors */
        public int getErrors() {
            return errors;
        }

        @Override
        public String toString() {
            return String.format("%s errors (%d) in: %s", kind, errors, sourceName);
        }
    }

    /**
     * Compile the source (actually an ANTLR stream) into a new parse tree. The parser emits parse
     * errors to {@code System.err}, but generally recovers to continue the parse. Errors are
     * counted, and if the count is positive, this method will throw {@link CFrontErrors}.
     *
     * @param input source text
     * @return the parse tree
     * @throws CFrontErrors when syntax errors
     */
    public static ProgramContext buildParseTree(CharStream input) throws CFrontErrors {

        // Wrap the input in a Lexer
        CFrontLexer lexer = new CFrontLexer(input);

        // Parse the token stream with the generated parser
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        CFrontParser parser = new CFrontParser(tokens);
        ProgramContext parseTree = parser.program();

        int errors = parser.getNumberOfSyntaxErrors();
        if (errors > 0) {
            throw new CFrontErrors(parser.getSourceName(), "Syntax", errors);
        }

        return parseTree;
    }
}
