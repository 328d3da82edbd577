package finder;

import finder.model.AirportDirectory;
import finder.model.AvailableItinerary;
import finder.model.CandidateItinerary;
import finder.model.Leg;
import finder.model.RouteGraph;
import finder.model.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final JsonMapper jsonMapper = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public static void main(String[] args) throws IOException {
        if (args.length != 3) {
            System.err.println("Usage: <config.json> <routes.json> <output-dir>");
            System.exit(2);
        }
        try {
            run(new File(args[0]), new File(args[1]), new File(args[2]), Clock.systemDefaultZone());
        } catch (FinderConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.exit(2);
        }
    }

    static RunReport run(File configFile, File routesFile, File outputDir, Clock clock) throws IOException {
        log.info("finder (config {}, routes {}, output {})", configFile, routesFile, outputDir);

        FinderConfig config = FinderConfig.read(configFile, jsonMapper);
        RouteGraph graph = readInput(routesFile, RouteGraph.class);
        log.info("Read {} ({} airports)", routesFile, graph.airports().size());
        AirportDirectory airports = config.airportCities() == null
                ? AirportDirectory.identity()
                : readInput(new File(config.airportCities()), AirportDirectory.class);
        CheckerFactory checkerFactory = AvailabilityCheckerProvider.named(config.checker()).create(config, airports);

        var enumerator = new ItineraryEnumerator(graph, config);
        List<CandidateItinerary> candidates = switch (config.mode()) {
            case ONE_WAY -> enumerator.enumerateOneStop(config.departureAirports(), config.destinationAirports(),
                    config.maxStops());
            case ROUND_TRIP -> enumerator.enumerateRoundTrip(config.departureAirports(), config.destinationAirports());
        };

        outputDir.mkdirs();
        jsonMapper.writeValue(new File(outputDir, "candidates.json"), candidates);
        if (candidates.isEmpty()) {
            log.info("No possible flights found, nothing to check");
        }

        List<Leg> legs = ItineraryEnumerator.distinctLegs(candidates);
        List<LocalDate> dates = config.checkDates(clock);
        log.info("Checking availability from {} to {}", dates.get(0), dates.get(dates.size() - 1));

        RunReport report;
        try (ResultStore store = ResultJournal.load(new File(outputDir, "checked.jsonl"))) {
            CheckRun run = new CheckOrchestrator(checkerFactory, config).runChecks(legs, dates, config.workers(), store);
            report = run.report();

            List<AvailableItinerary> available = new Reconciler(airports).reconcile(candidates, run.results());
            jsonMapper.writeValue(new File(outputDir, "available.json"), available);
            jsonMapper.writeValue(new File(outputDir, "report.json"), report);
            log.info("Wrote {} available itineraries to {}", available.size(), outputDir);
        }

        if (!report.isComplete()) {
            log.warn("Results may be incomplete for {} legs ({} checks failed)", report.getIncompleteLegs(), report.failed());
        }
        return report;
    }

    private static <T> T readInput(File file, Class<T> type) {
        try {
            return jsonMapper.readValue(file, type);
        } catch (JacksonException e) {
            throw new FinderConfigurationException("Cannot read " + file + ": " + e.getOriginalMessage(), e);
        }
    }
}
