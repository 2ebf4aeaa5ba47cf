package com.infocode.cli;

import com.infocode.analysis.FilterMode;
import com.infocode.config.AppConfig;
import com.infocode.core.CodingException;
import com.infocode.core.TokenMode;
import com.infocode.model.AnalysisReport;
import com.infocode.model.FilterReport;
import com.infocode.service.AnalysisService;
import com.infocode.text.TextCleaner;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Command-line interface for text entropy and prefix-code analysis.
 *
 * Usage:
 *   Analyze: java -jar infocode.jar analyze <input-file> [unigram|bigram]
 *   Entropy: java -jar infocode.jar entropy <input-file>
 *   Filter:  java -jar infocode.jar filter <input-file> [top|bottom] [fraction]
 */
public class InfoCodeCLI {

    private static final Logger logger = LoggerFactory.getLogger(InfoCodeCLI.class);

    private final AppConfig config;
    private final AnalysisService service;
    private final PrintStream out;
    private final PrintStream err;

    public InfoCodeCLI(AppConfig config, PrintStream out) {
        this(config, out, System.err);
    }

    /**
     * @param out Reports and usage text
     * @param err Error messages
     */
    public InfoCodeCLI(AppConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.service = new AnalysisService(config);
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new InfoCodeCLI(new AppConfig(), System.out).run(args);
        } catch (ConfigException e) {
            logger.error("Invalid configuration", e);
            System.err.println("Configuration error: " + e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Run one command.
     *
     * @return Process exit code
     */
    public int run(String[] args) {
        if (args.length < 2) {
            printUsage();
            return 1;
        }

        String operation = args[0].toLowerCase(Locale.ROOT);
        Path input = Paths.get(args[1]);

        if (!Files.exists(input)) {
            err.println("Error: Input file does not exist: " + input);
            return 1;
        }

        try {
            String text = readText(input);

            switch (operation) {
                case "analyze":
                case "a":
                    TokenMode mode = args.length > 2 ? TokenMode.fromName(args[2]) : config.getTokenMode();
                    analyze(text, mode);
                    break;

                case "entropy":
                case "e":
                    entropy(text);
                    break;

                case "filter":
                case "f":
                    FilterMode filterMode = args.length > 2 ? FilterMode.fromName(args[2]) : config.getFilterMode();
                    double fraction = args.length > 3 ? Double.parseDouble(args[3]) : config.getFilterFraction();
                    filter(text, filterMode, fraction);
                    break;

                default:
                    err.println("Unknown operation: " + operation);
                    printUsage();
                    return 1;
            }
            return 0;

        } catch (IOException e) {
            logger.error("Failed to read {}", input, e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (CodingException e) {
            logger.error("Coding failed", e);
            err.println("Coding error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Invalid argument: " + e.getMessage());
            printUsage();
            return 1;
        } catch (IllegalStateException e) {
            logger.error("Analysis failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private String readText(Path input) throws IOException {
        String raw = Files.readString(input, config.getInputCharset());
        TextCleaner cleaner = config.createTextCleaner();
        String text = cleaner.clean(raw);
        logger.info("Read {} characters from {} ({} after cleaning)", raw.length(), input, text.length());
        return text;
    }

    private void analyze(String text, TokenMode mode) {
        out.println("Text: " + text);
        out.println();
        AnalysisReport report = service.analyze(text, mode, config.getAlgorithms());
        out.print(report.getSummary(config.getReportPrecision(), config.getMaxEncodedChars()));
    }

    private void entropy(String text) {
        int precision = config.getReportPrecision();
        for (TokenMode mode : TokenMode.values()) {
            out.print(service.analyzeEntropy(text, mode).getSummary(precision));
            out.println();
        }
    }

    private void filter(String text, FilterMode mode, double fraction) {
        FilterReport report = service.filter(text, mode, fraction);
        out.println("Baseline entropy: " + String.format(Locale.ROOT, "%." + config.getReportPrecision() + "f",
            report.getBaselineEntropy()));
        out.print(report.getSummary(config.getReportPrecision(), config.getMaxEncodedChars()));
    }

    private void printUsage() {
        out.println("InfoCode - entropy and prefix-code analysis of text");
        out.println();
        out.println("Usage:");
        out.println("  Analyze: java -jar infocode.jar analyze <input-file> [unigram|bigram]");
        out.println("  Entropy: java -jar infocode.jar entropy <input-file>");
        out.println("  Filter:  java -jar infocode.jar filter <input-file> [top|bottom] [fraction]");
        out.println();
        out.println("Examples:");
        out.println("  java -jar infocode.jar analyze book.txt bigram");
        out.println("  java -jar infocode.jar filter book.txt bottom 0.2");
        out.println();
        out.println("Short forms:");
        out.println("  'a' for analyze, 'e' for entropy, 'f' for filter");
    }
}
