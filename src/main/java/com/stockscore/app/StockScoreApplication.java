package com.stockscore.app;

import com.stockscore.ai.LangChainModelService;
import com.stockscore.ai.ModelService;
import com.stockscore.ai.OllamaChatService;
import com.stockscore.config.Config;
import com.stockscore.data.JsonFileQuoteSource;
import com.stockscore.data.QuoteSource;
import com.stockscore.data.YahooQuoteSource;
import com.stockscore.data.http.HttpClientEx;
import com.stockscore.model.Quote;
import com.stockscore.output.BatchFatalException;
import com.stockscore.output.ProgressStore;
import com.stockscore.runner.BatchOrchestrator;
import com.stockscore.runner.BatchOutcome;
import com.stockscore.scoring.Scorer;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class StockScoreApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new StockScoreApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("stockscore", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("stockscore", options);
            return 0;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);
            Logger log = LogManager.getLogger(StockScoreApplication.class);

            List<String> symbols = resolveSymbols(cmd, config);
            if (symbols.isEmpty()) {
                System.err.println("ERROR: stock list is empty (use --symbols or config stock.list).");
                return 2;
            }

            QuoteSource quoteSource = buildQuoteSource(cmd, config);
            Map<String, Quote> quotes = quoteSource.fetch(symbols);
            List<String> missing = new ArrayList<>();
            for (String s : symbols) {
                if (!quotes.containsKey(s)) {
                    missing.add(s);
                }
            }
            if (!missing.isEmpty()) {
                log.warn("{} requested entities have no quote: {}", missing.size(), String.join(", ", missing));
            }

            ModelService model = buildModelService(config);
            log.info("model={} (source={}) temperature={} timeout_sec={}",
                    model.describe(),
                    config.sourceOf("ai.model"),
                    config.getDouble("ai.temperature", 0.7),
                    config.getInt("ai.timeout_sec", 180));

            Clock clock = Clock.systemDefaultZone();
            ProgressStore store = new ProgressStore(config.getPath("outputs.dir").resolve("progress"), clock);
            BatchOrchestrator orchestrator = new BatchOrchestrator(Scorer.fromConfig(config, model), store, clock, model.describe());

            BatchOutcome outcome = orchestrator.run(cmd.getOptionValue("run-id"), symbols, quotes);
            System.out.println(String.format(
                    Locale.US,
                    "Scoring finished: %d/%d succeeded (%.1f%%). Output: %s",
                    outcome.succeeded,
                    outcome.total,
                    outcome.coverage * 100.0,
                    outcome.outputDir.toAbsolutePath()
            ));
            return outcome.succeeded > 0 || outcome.total == 0 ? 0 : 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted; the last progress snapshot is kept on disk.");
            return 1;
        } catch (BatchFatalException e) {
            System.err.println("FATAL: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    static List<String> resolveSymbols(CommandLine cmd, Config config) {
        String raw = cmd.getOptionValue("symbols", config.getString("stock.list"));
        List<String> out = new ArrayList<>();
        for (String token : raw.split("[,;]")) {
            String t = token.trim();
            if (!t.isEmpty()) {
                out.add(t);
            }
        }
        return out;
    }

    static ModelService buildModelService(Config config) {
        String provider = config.getString("ai.provider", "langchain4j").toLowerCase(Locale.ROOT);
        if ("ollama-http".equals(provider)) {
            return new OllamaChatService(
                    new HttpClientEx(),
                    config.getString("ai.base_url"),
                    config.getString("ai.model"),
                    config.getInt("ai.max_tokens", 0)
            );
        }
        return new LangChainModelService(config);
    }

    private static QuoteSource buildQuoteSource(CommandLine cmd, Config config) {
        String source = cmd.getOptionValue("quote-source", config.getString("quotes.source", "file")).toLowerCase(Locale.ROOT);
        if ("yahoo".equals(source)) {
            return new YahooQuoteSource(new HttpClientEx(), Duration.ofSeconds(Math.max(5, config.getInt("quotes.timeout_sec", 30))));
        }
        Path path = cmd.hasOption("quotes")
                ? config.workingDir().resolve(cmd.getOptionValue("quotes")).normalize()
                : config.getPath("quotes.path");
        return new JsonFileQuoteSource(path);
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (StockScoreApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("stockscore.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j first so the console appender keeps the original streams.
                LogManager.getLogger(StockScoreApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("help").desc("Show help").build());
        options.addOption(Option.builder().longOpt("symbols").hasArg().argName("LIST")
                .desc("Comma-separated entity ids, e.g. NVDA.US,AAPL.US (default: config stock.list)").build());
        options.addOption(Option.builder().longOpt("quotes").hasArg().argName("FILE")
                .desc("Quote JSON file (default: config quotes.path)").build());
        options.addOption(Option.builder().longOpt("quote-source").hasArg().argName("file|yahoo")
                .desc("Quote source (default: config quotes.source)").build());
        options.addOption(Option.builder().longOpt("run-id").hasArg().argName("ID")
                .desc("Run id used for the progress directory (default: start timestamp)").build());
        return options;
    }
}
