package pl.marcinmilkowski.sense_reducer;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_reducer.config.ReducerConfig;
import pl.marcinmilkowski.sense_reducer.io.WitnessBatch;
import pl.marcinmilkowski.sense_reducer.io.WitnessBatchReader;
import pl.marcinmilkowski.sense_reducer.model.Language;
import pl.marcinmilkowski.sense_reducer.model.Mode;
import pl.marcinmilkowski.sense_reducer.model.ReducedSenseSet;
import pl.marcinmilkowski.sense_reducer.model.SemanticConstant;
import pl.marcinmilkowski.sense_reducer.normalize.GlossNormalizer;
import pl.marcinmilkowski.sense_reducer.normalize.LexiconLoader;
import pl.marcinmilkowski.sense_reducer.pipeline.SenseReducer;
import pl.marcinmilkowski.sense_reducer.registry.LuceneSemanticConstantRegistry;
import pl.marcinmilkowski.sense_reducer.registry.RegistryUnavailableException;
import pl.marcinmilkowski.sense_reducer.registry.SemanticConstantRegistry;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Locale;

/**
 * Command-line entry point: reduce a witness file, list or promote semantic constants, and
 * dump the bundled lexicons.
 *
 * <p>Results are printed to standard output as JSON; messages go to standard error.</p>
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase(Locale.ROOT);

            switch (command) {
                case "reduce":
                    handleReduceCommand(args);
                    break;
                case "constants":
                    handleConstantsCommand(args);
                    break;
                case "promote":
                    handlePromoteCommand(args);
                    break;
                case "lexicon":
                    handleLexiconCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: " + command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    private static void handleReduceCommand(String[] args) throws IOException {
        String inputFile = null;
        String registryPath = null;
        String configFile = null;
        Mode mode = Mode.OPEN;
        boolean evidence = false;
        boolean summary = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    inputFile = args[++i];
                    break;
                case "--mode":
                case "-m":
                    mode = Mode.parse(args[++i]);
                    break;
                case "--evidence":
                    evidence = true;
                    break;
                case "--summary":
                    summary = true;
                    break;
                case "--registry":
                case "-r":
                    registryPath = args[++i];
                    break;
                case "--config":
                case "-c":
                    configFile = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (inputFile == null) {
            System.err.println("Error: --input is required");
            System.err.println("Usage: java -jar sense-reducer.jar reduce --input <wsus.json> [--mode open|skeptic]");
            return;
        }

        ReducerConfig config = configFile != null
            ? ReducerConfig.load(Paths.get(configFile))
            : ReducerConfig.defaults();
        WitnessBatch batch = WitnessBatchReader.read(Paths.get(inputFile));
        GlossNormalizer normalizer = new GlossNormalizer(config.stripStopwords());

        SemanticConstantRegistry registry = null;
        if (registryPath != null) {
            try {
                registry = LuceneSemanticConstantRegistry.open(Paths.get(registryPath), normalizer,
                    config.matchThreshold(), Clock.systemUTC());
            } catch (RegistryUnavailableException e) {
                logger.warn("Continuing without semantic constants: {}", e.getMessage());
                System.err.println("Warning: " + e.getMessage());
            }
        }

        try {
            SenseReducer reducer = new SenseReducer(normalizer, registry, config);
            ReducedSenseSet result = reducer.reduce(batch.toRequest(mode));
            if (summary) {
                JSONObject out = new JSONObject();
                out.put("lemma", result.lemma());
                out.put("mode", result.mode().getCode());
                out.put("witnesses", result.witnessSummary());
                out.put("buckets", new JSONArray(result.bucketSummaries()));
                out.put("warnings", new JSONArray(result.warnings()));
                print(out);
            } else {
                print(result.toJson(evidence));
            }
        } finally {
            if (registry != null) {
                registry.close();
            }
        }
    }

    private static void handleConstantsCommand(String[] args) {
        Path registryPath = parseRegistryPath(args);
        if (registryPath == null) {
            System.err.println("Error: --registry is required");
            System.err.println("Usage: java -jar sense-reducer.jar constants --registry <dir>");
            return;
        }

        try (LuceneSemanticConstantRegistry registry =
                 LuceneSemanticConstantRegistry.open(registryPath, new GlossNormalizer())) {
            JSONArray constants = new JSONArray();
            for (SemanticConstant constant : registry.constants()) {
                constants.add(constant.toJson());
            }
            print(constants);
        }
    }

    private static void handlePromoteCommand(String[] args) {
        Path registryPath = parseRegistryPath(args);
        String constantId = null;
        for (int i = 1; i < args.length; i++) {
            if ("--id".equals(args[i]) && i + 1 < args.length) {
                constantId = args[++i];
            }
        }

        if (registryPath == null || constantId == null) {
            System.err.println("Error: --registry and --id are required");
            System.err.println("Usage: java -jar sense-reducer.jar promote --registry <dir> --id <CONSTANT_ID>");
            return;
        }

        try (LuceneSemanticConstantRegistry registry =
                 LuceneSemanticConstantRegistry.open(registryPath, new GlossNormalizer())) {
            registry.promote(constantId);
            registry.get(constantId).ifPresent(c -> print(c.toJson()));
        }
    }

    private static void handleLexiconCommand(String[] args) {
        Language language = null;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--language":
                case "-l":
                    language = Language.fromCode(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }
        print(language != null
            ? LexiconLoader.loadBundled(language).toJson()
            : LexiconLoader.loadCommon().toJson());
    }

    private static Path parseRegistryPath(String[] args) {
        for (int i = 1; i < args.length - 1; i++) {
            if ("--registry".equals(args[i]) || "-r".equals(args[i])) {
                return Paths.get(args[i + 1]);
            }
        }
        return null;
    }

    private static void print(Object json) {
        System.out.println(JSON.toJSONString(json, JSONWriter.Feature.PrettyFormat, JSONWriter.Feature.WriteMapNullValue));
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar sense-reducer.jar <command> [options]");
        System.out.println();
        System.out.println("Available commands:");
        System.out.println("  reduce     - Cluster the witness senses of one lemma into sense buckets");
        System.out.println("  constants  - List the semantic constants of a registry");
        System.out.println("  promote    - Promote a provisional semantic constant to curated");
        System.out.println("  lexicon    - Print a bundled normalization lexicon");
        System.out.println("  help       - Show this help message");
        System.out.println();
        System.out.println("Reduce command:");
        System.out.println("  java -jar sense-reducer.jar reduce --input <wsus.json> [--mode open|skeptic]");
        System.out.println("    [--evidence] [--summary] [--registry <dir>] [--config <reducer.json>]");
        System.out.println();
        System.out.println("  Modes:");
        System.out.println("    open: consolidate witnesses into fewer, broader senses (default)");
        System.out.println("    skeptic: split unless metadata, entity type and sources agree");
        System.out.println();
        System.out.println("Constants command:");
        System.out.println("  java -jar sense-reducer.jar constants --registry <dir>");
        System.out.println();
        System.out.println("Promote command:");
        System.out.println("  java -jar sense-reducer.jar promote --registry <dir> --id <CONSTANT_ID>");
        System.out.println();
        System.out.println("Lexicon command:");
        System.out.println("  java -jar sense-reducer.jar lexicon [--language lat|grc|san]");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar sense-reducer.jar reduce --input shiva.json --mode skeptic --evidence");
        System.out.println("  java -jar sense-reducer.jar reduce --input shiva.json --registry data/constants/");
        System.out.println("  java -jar sense-reducer.jar promote --registry data/constants/ --id AUSPICIOUS_BENIGN");
    }
}
