package com.posetal;

import static com.google.common.base.Preconditions.checkArgument;
import static picocli.CommandLine.ArgGroup;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

import com.google.common.base.Stopwatch;
import com.google.common.collect.Sets;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.posetal.algorithm.EquilibriumFinder;
import com.posetal.algorithm.EquilibriumFinder.Concept;
import com.posetal.generator.RandomGames;
import com.posetal.learning.CandidateOrderSet;
import com.posetal.learning.Distribution;
import com.posetal.learning.JointLearning;
import com.posetal.learning.LearningConfig;
import com.posetal.learning.LearningSession;
import com.posetal.learning.WeightedVoting;
import com.posetal.model.ActionProfile;
import com.posetal.model.Player;
import com.posetal.model.PosetalGame;
import com.posetal.model.PriorityOrder;
import com.posetal.order.OrderClass;
import com.posetal.output.DotWriter;
import com.posetal.output.Formatter;
import com.posetal.parser.GameParser;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import picocli.CommandLine;

@Command(
    name = "posetal",
    mixinStandardHelpOptions = true,
    version = "Posetal Games 0.1",
    description = "Computes equilibria of posetal games and learns priority orders from play")
public final class Main implements Callable<Integer> {
    private static final Logger log = Logger.getLogger(Main.class.getName());
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private static PrintStream open(String output) throws IOException {
        return new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))), false,
            StandardCharsets.UTF_8);
    }

    private static <S> void writeIfPresent(@Nullable String output, S object, BiConsumer<S, PrintStream> formatter)
        throws IOException {
        if (output == null) {
            return;
        }
        if ("-".equals(output)) {
            formatter.accept(object, System.out);
            System.out.flush();
        } else {
            try (var stream = open(output)) {
                formatter.accept(object, stream);
            }
        }
    }

    @ArgGroup(heading = "game%n", multiplicity = "1")
    private GameSource gameSource;

    static class GameSource {
        @Nullable
        @Option(names = "--game", description = "Source file in JSON format")
        private String json;

        @Nullable
        @Option(names = "--random", split = ",", description = "Random game: <players>,<actions>,<metrics>")
        private List<Integer> random;
    }

    @Option(
        names = {"--concept"},
        description = "Equilibrium concept. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private Concept concept = Concept.PURE_NASH;

    @Nullable
    @Option(
        names = {"--learn"},
        description = "Learn the priority order of this player from simulated equilibrium play")
    private String learn;

    @Option(
        names = {"--joint"},
        description = "Run this many iterations of joint learning among all players")
    private int joint = 0;

    @Option(
        names = {"--rounds"},
        description = "Number of observations, default: ${DEFAULT-VALUE}")
    private int rounds = 20;

    @Option(
        names = {"--mode"},
        description = "Belief update. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private LearningConfig.VotingMode mode = LearningConfig.VotingMode.PROBABILITY;

    @Option(
        names = {"--aggregation"},
        description = "Joint learning vote aggregation. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private WeightedVoting.Aggregation aggregation = WeightedVoting.Aggregation.SUM;

    @Option(
        names = {"--scoring"},
        description = "Candidate scoring. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private LearningConfig.Scoring scoring = LearningConfig.Scoring.EQUILIBRIUM;

    @Option(
        names = {"--order-class"},
        description = "Candidate orders. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private OrderClass orderClass = OrderClass.PREORDER;

    @Option(
        names = {"--threshold"},
        description = "Stop learning once a candidate has this weight, default: ${DEFAULT-VALUE}")
    private double threshold = 0.99;

    @Option(
        names = {"--seed"},
        description = "Random seed, default: ${DEFAULT-VALUE}")
    private long seed = 42L;

    @Option(
        names = {"-O", "--output"},
        description = "Write the results as JSON")
    private String writeOutput = "-";

    @Nullable
    @Option(
        names = {"--write-dot-priority"},
        description = "Write the Hasse diagrams of all priority orders")
    private String writeDotPriority;

    @Option(
        names = {"--write-dot-induced"},
        description = "Write the order a player induces on profiles (format: <player>,<destination>)")
    private List<String> writeDotInduced = List.of();

    private Main() {}

    private record Input(PosetalGame game, @Nullable Set<ActionProfile> expected) {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new Main())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
    }

    private Input readGame() throws IOException {
        if (gameSource.json == null) {
            assert gameSource.random != null;
            checkArgument(gameSource.random.size() == 3, "Expected <players>,<actions>,<metrics>");
            return new Input(RandomGames.generate(gameSource.random.get(0), gameSource.random.get(1),
                gameSource.random.get(2), orderClass, new Random(seed)), null);
        }
        JsonObject jsonObject;
        try (BufferedReader reader = Files.newBufferedReader(Path.of(gameSource.json))) {
            jsonObject = JsonParser.parseReader(reader).getAsJsonObject();
        }
        PosetalGame game = GameParser.parse(jsonObject);
        return new Input(game, GameParser.parseExpected(jsonObject, game));
    }

    @Override
    public Integer call() throws Exception {
        Input input = readGame();
        PosetalGame game = input.game();
        log.log(Level.INFO, () -> "Read game %s with %d profiles".formatted(game.name(), game.profiles().size()));

        writeIfPresent(writeDotPriority, game, (g, stream) -> g.players().forEach(player -> {
            stream.println("// " + Formatter.format(player));
            DotWriter.writeOrder(player.priority().relation(), stream);
        }));
        for (String entry : writeDotInduced) {
            String[] parts = entry.split(",");
            checkArgument(parts.length == 2, "Expected <player>,<destination>, got %s", entry);
            Player player = game.player(parts[0]);
            writeIfPresent(parts[1], game, (g, stream) -> DotWriter.writeInducedOrder(g, player, stream));
        }

        Stopwatch overall = Stopwatch.createStarted();
        Set<ActionProfile> equilibria = EquilibriumFinder.find(game, concept);
        log.log(Level.INFO, () -> "Found %s equilibria %s in %s"
            .formatted(concept, Formatter.format(equilibria, game), overall));

        JsonObject result = new JsonObject();
        result.addProperty("game", game.name());
        result.addProperty("concept", concept.name());
        result.add("equilibria", profiles(equilibria));
        if (learn != null) {
            result.add("learning", learn(game, game.player(learn)));
        }
        if (joint > 0) {
            result.add("joint", jointLearning(game));
        }
        writeIfPresent(writeOutput, result, (json, stream) -> stream.println(GSON.toJson(json)));

        if (input.expected() != null && !validate(game, equilibria, input.expected())) {
            return 1;
        }
        return 0;
    }

    private JsonObject learn(PosetalGame game, Player target) {
        LearningConfig config = LearningConfig.builder()
            .mode(mode)
            .scoring(scoring)
            .concept(concept)
            .maxRounds(rounds)
            .concentrationThreshold(threshold)
            .build();
        CandidateOrderSet candidates = CandidateOrderSet.enumerate(target.metrics(), orderClass);
        LearningSession session = LearningSession.start(game, target, candidates, config);

        Random random = new Random(seed);
        List<ActionProfile> pool = new ArrayList<>(EquilibriumFinder.find(game, concept));
        if (pool.isEmpty()) {
            log.log(Level.WARNING, "No equilibrium to observe, observing uniformly random play");
            pool.addAll(game.profiles());
        }
        List<ActionProfile> observations = new ArrayList<>(rounds);
        for (int i = 0; i < rounds; i++) {
            observations.add(pool.get(random.nextInt(pool.size())));
        }
        session.run(observations);

        JsonObject learning = new JsonObject();
        learning.addProperty("player", target.name());
        learning.addProperty("truth", target.priority().toString());
        learning.addProperty("rounds", session.rounds());
        learning.add("observations", profiles(observations.subList(0, session.rounds())));
        JsonArray history = new JsonArray();
        session.history().forEach(belief -> history.add(distribution(belief)));
        learning.add("history", history);
        learning.add("mostLikely", orders(session.mostLikely()));
        return learning;
    }

    private JsonObject jointLearning(PosetalGame game) {
        Map<Player, CandidateOrderSet> candidates = new LinkedHashMap<>();
        game.players().forEach(p -> candidates.put(p, CandidateOrderSet.enumerate(p.metrics(), orderClass)));
        WeightedVoting voting = new WeightedVoting(game, aggregation, concept);
        JointLearning learning = JointLearning.start(game, candidates, voting, new Random(seed));
        List<ActionProfile> plays = learning.simulate(joint);

        JsonObject result = new JsonObject();
        result.add("plays", profiles(plays));
        JsonObject beliefs = new JsonObject();
        for (Player player : game.players()) {
            JsonObject belief = new JsonObject();
            belief.addProperty("truth", player.priority().toString());
            belief.add("final", distribution(learning.belief(player)));
            belief.add("mostLikely", orders(learning.mostLikely().get(player)));
            beliefs.add(player.name(), belief);
        }
        result.add("beliefs", beliefs);
        return result;
    }

    private static JsonArray profiles(Iterable<ActionProfile> profiles) {
        JsonArray array = new JsonArray();
        for (ActionProfile profile : profiles) {
            JsonObject object = new JsonObject();
            profile.names().forEach(object::addProperty);
            array.add(object);
        }
        return array;
    }

    private static JsonObject distribution(Distribution<PriorityOrder> distribution) {
        JsonObject object = new JsonObject();
        distribution.asMap().forEach((order, weight) -> object.addProperty(order.toString(), weight));
        return object;
    }

    private static JsonArray orders(Set<PriorityOrder> orders) {
        JsonArray array = new JsonArray();
        orders.forEach(order -> array.add(order.toString()));
        return array;
    }

    private static boolean validate(PosetalGame game, Set<ActionProfile> found, Set<ActionProfile> expected) {
        if (found.equals(expected)) {
            return true;
        }
        var invalid = Sets.difference(found, expected);
        var missing = Sets.difference(expected, found);
        System.err.println("Validation failed!");
        if (!invalid.isEmpty()) {
            System.err.println("Invalid equilibria:");
            invalid.forEach(p -> System.err.println(Formatter.format(p, game)));
        }
        if (!missing.isEmpty()) {
            System.err.println("Missing equilibria:");
            missing.forEach(p -> System.err.println(Formatter.format(p, game)));
        }
        return false;
    }
}
