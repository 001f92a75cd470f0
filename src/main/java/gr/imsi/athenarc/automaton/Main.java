package gr.imsi.athenarc.automaton;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;
import java.util.Scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;

import gr.imsi.athenarc.automaton.config.AutomatonConfiguration;
import gr.imsi.athenarc.automaton.io.ConsoleReporter;
import gr.imsi.athenarc.automaton.io.TokenReader;
import gr.imsi.athenarc.automaton.io.TransitionTablePrinter;
import gr.imsi.athenarc.automaton.nfa.Preset;
import gr.imsi.athenarc.automaton.nfa.TransitionTable;

public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @Parameter(names = "-file", description = "Path of the input file; prompted for on stdin when missing")
    String file;

    @Parameter(names = "-preset", converter = PresetConverter.class, description = "Transition table to use (FIVE_STATE, TEN_STATE)")
    Preset preset;

    @Parameter(names = "-separator", description = "Token separator of the input file")
    String separator;

    @Parameter(names = "--help", help = true, description = "Displays help")
    boolean help;

    public static void main(String... args) {
        Main main = new Main();
        JCommander jCommander = new JCommander(main);
        jCommander.setProgramName("nfa-simulator");
        jCommander.parse(args);
        if (main.help) {
            jCommander.usage();
        } else {
            main.run(AutomatonConfiguration.load(), System.in, System.out);
        }
    }

    /** Command-line options take precedence over the loaded configuration. */
    AutomatonConfiguration resolve(AutomatonConfiguration configuration) {
        AutomatonConfiguration.Builder builder = configuration.toBuilder();
        if (preset != null) {
            builder.preset(preset);
        }
        if (separator != null) {
            builder.tokenSeparator(separator);
        }
        return builder.build();
    }

    List<TokenResult> run(AutomatonConfiguration loaded, InputStream in, PrintStream out) {
        AutomatonConfiguration configuration = resolve(loaded);
        LOG.info("Running with {}", configuration);
        TransitionTable table = configuration.getPreset().table();

        out.println("Transition table:");
        TransitionTablePrinter.print(table.toMatrix(), out);

        String filepath = file;
        if (filepath == null) {
            out.print("Please enter file path: ");
            out.flush();
            Scanner scanner = new Scanner(in);
            filepath = scanner.hasNext() ? scanner.next() : "";
        }

        List<String> tokens = new TokenReader(configuration.getTokenSeparator()).read(Paths.get(filepath));
        ConsoleReporter reporter = new ConsoleReporter(out);
        if (tokens.isEmpty()) {
            reporter.message("File not found, is not readable or has no content");
        }
        return new AutomatonRunner(table, reporter).runAll(tokens);
    }
}
