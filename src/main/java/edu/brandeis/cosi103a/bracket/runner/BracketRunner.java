package edu.brandeis.cosi103a.bracket.runner;

import edu.brandeis.cosi103a.bracket.core.Bracket;
import edu.brandeis.cosi103a.bracket.core.BracketBuilder;
import edu.brandeis.cosi103a.bracket.core.Competitor;
import edu.brandeis.cosi103a.bracket.core.Match;
import edu.brandeis.cosi103a.bracket.core.Propagator;
import edu.brandeis.cosi103a.bracket.core.Seeder;
import edu.brandeis.cosi103a.bracket.core.SlotPosition;
import edu.brandeis.cosi103a.bracket.core.StaleWinnerDetector;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Main entry point for the bracket runner CLI.
 *
 * <p>Invocation:
 * <pre>
 * java -cp bracket-runner.jar edu.brandeis.cosi103a.bracket.runner.BracketRunner \
 *   --name spring-open --output ./data \
 *   --player Alice=1 --player Bob=2 --player Carol --player Dave --player Erin \
 *   --winner r1-m2=carol --pools
 * </pre>
 *
 * <p>Re-running with the same name reuses the existing bracket.json, so results can be
 * entered a few at a time.
 */
public class BracketRunner {

    public static void main(String[] args) {
        if (args.length == 0 || "--help".equals(args[0])) {
            printUsage();
            System.exit(args.length == 0 ? 1 : 0);
        }

        TournamentConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        Path outputDir = parseOutputDir(args).resolve(config.name());

        try {
            Bracket bracket = runBracket(config, outputDir);
            printSummary(config, bracket);
            System.out.printf("Bracket written to %s%n", outputDir);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Bracket run failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Builds (or resumes) the bracket, applies the declared winners and writes both files.
     *
     * @return the bracket as written
     * @throws IllegalArgumentException if an existing bracket.json was seeded from other players
     */
    static Bracket runBracket(TournamentConfig config, Path outputDir) throws IOException {
        BracketFileWriter writer = new BracketFileWriter(outputDir);

        List<Competitor> ordered = CompetitorOrdering.bySeed(config.competitors());
        Bracket bracket;
        if (writer.bracketExists()) {
            bracket = writer.readBracket().orElseThrow();
            Set<String> existingIds = playerIds(bracket);
            Set<String> requestedIds = ordered.stream().map(Competitor::id).collect(Collectors.toSet());
            if (!existingIds.equals(requestedIds)) {
                throw new IllegalArgumentException(String.format(
                    "Existing bracket in %s was seeded with players %s, not %s; use a new --name",
                    outputDir, new TreeSet<>(existingIds), new TreeSet<>(requestedIds)));
            }
            System.out.println("bracket.json already exists, applying results to it");
        } else {
            bracket = BracketBuilder.build(Seeder.seed(ordered));
        }

        List<Pool> pools = config.pools() ? PoolDistributor.distribute(ordered) : List.of();
        writer.writeTournamentMetadata(config.name(), ordered, pools);

        for (TournamentConfig.WinnerDeclaration declaration : config.winners()) {
            Bracket next = Propagator.applyWinner(bracket, declaration.matchId(), declaration.competitorId());
            if (next == bracket) {
                System.err.printf("Ignored result %s=%s: unknown match or bye%n",
                    declaration.matchId(), declaration.competitorId());
            }
            bracket = next;
        }

        for (String matchId : StaleWinnerDetector.findStaleMatches(bracket)) {
            System.err.printf("Warning: winner of %s no longer matches its competitors%n", matchId);
        }

        writer.writeBracket(bracket);
        return bracket;
    }

    /**
     * Ids of the real (non-bye) competitors in the first round.
     */
    private static Set<String> playerIds(Bracket bracket) {
        Set<String> ids = new HashSet<>();
        if (bracket.rounds().isEmpty()) {
            return ids;
        }
        for (Match match : bracket.rounds().get(0).matches()) {
            for (SlotPosition position : SlotPosition.values()) {
                match.slot(position).filter(c -> !c.bye()).ifPresent(c -> ids.add(c.id()));
            }
        }
        return ids;
    }

    /**
     * Parses CLI arguments into a TournamentConfig.
     *
     * @throws IllegalArgumentException if required arguments are missing or malformed
     */
    static TournamentConfig parseArgs(String[] args) {
        String name = null;
        boolean pools = false;
        List<Competitor> competitors = new ArrayList<>();
        List<TournamentConfig.WinnerDeclaration> winners = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--name" -> name = requireValue(args, ++i, "--name");
                case "--output" -> i++; // consumed but stored separately
                case "--pools" -> pools = true;
                case "--player" -> {
                    Competitor competitor = parsePlayer(requireValue(args, ++i, "--player"));
                    if (!ids.add(competitor.id())) {
                        throw new IllegalArgumentException("Duplicate player id: " + competitor.id());
                    }
                    competitors.add(competitor);
                }
                case "--winner" -> {
                    String arg = requireValue(args, ++i, "--winner");
                    int eq = arg.indexOf('=');
                    if (eq <= 0 || eq == arg.length() - 1) {
                        throw new IllegalArgumentException("Invalid winner argument: " + arg);
                    }
                    winners.add(new TournamentConfig.WinnerDeclaration(
                        arg.substring(0, eq), arg.substring(eq + 1)));
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (name == null) {
            throw new IllegalArgumentException("Missing required argument: --name");
        }
        if (competitors.size() < 2) {
            throw new IllegalArgumentException("Need at least 2 players for a bracket");
        }

        return new TournamentConfig(name, competitors, winners, pools);
    }

    /**
     * Parses {@code Name} or {@code Name=seed}.
     */
    static Competitor parsePlayer(String arg) {
        int eq = arg.indexOf('=');
        String playerName = eq < 0 ? arg : arg.substring(0, eq);
        if (playerName.isBlank()) {
            throw new IllegalArgumentException("Invalid player argument: " + arg);
        }
        String playerId = Competitor.idFromName(playerName);
        if (Competitor.isReservedId(playerId)) {
            throw new IllegalArgumentException("Player id is reserved for byes: " + playerId);
        }
        if (eq < 0) {
            return Competitor.of(playerId, playerName);
        }
        try {
            return Competitor.seeded(playerId, playerName, Integer.parseInt(arg.substring(eq + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid seed in player argument: " + arg, e);
        }
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }

    private static Path parseOutputDir(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--output".equals(args[i])) {
                return Path.of(args[i + 1]);
            }
        }
        return Path.of("./data");
    }

    private static void printSummary(TournamentConfig config, Bracket bracket) {
        int slots = bracket.slotCount();
        System.out.printf("%s: %d competitors, %d slots, %d byes, %d rounds%n",
            config.name(), config.competitors().size(), slots,
            slots - config.competitors().size(), bracket.roundCount());
        System.out.printf("Completion: %d%% (%d/%d matches decided)%n",
            bracket.completionPercentage(), bracket.decidedMatches(), bracket.totalMatches());
        bracket.champion().ifPresent(c -> System.out.printf("Champion: %s%n", c.name()));
    }

    private static void printUsage() {
        System.err.println("Usage: bracket-runner --name <name> --player <Name>[=<seed>]... [options]");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --name <name>                     Tournament name (required)");
        System.err.println("  --player <Name>[=<seed>]          Add a competitor (at least 2 required)");
        System.err.println("  --winner <matchId>=<competitorId> Record a result, e.g. r1-m2=alice");
        System.err.println("  --output <dir>                    Output directory (default: ./data)");
        System.err.println("  --pools                           Split competitors into pools in tournament.json");
        System.err.println();
        System.err.println("Competitor ids are the lowercased name with non-alphanumerics replaced by '-'.");
    }
}
