package org.qosroute.routing.solver.genetic;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.qosroute.routing.cost.CostModel;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.graph.Paths;
import org.qosroute.routing.search.RandomWalkSearch;
import org.qosroute.routing.search.ShortestPathSearch;
import org.qosroute.routing.solver.FailureReason;
import org.qosroute.routing.solver.PathSolver;
import org.qosroute.routing.solver.SearchCancellation;
import org.qosroute.routing.solver.SearchProblem;
import org.qosroute.routing.solver.SolverResult;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Evolutionary path search over the bandwidth-filtered graph.
 * <p>
 * Pipeline per generation:
 * <ol>
 * <li>Copy the {@code eliteCount} fittest individuals unchanged.</li>
 * <li>Fill the rest with children of two tournament winners: splice at a shared interior node
 * with probability {@code crossoverRate}, otherwise copy the fitter parent.</li>
 * <li>With probability {@code mutationRate}, re-route one interior node of the child through a
 * random sub-path between its neighbors.</li>
 * </ol>
 * Children that revisit a node are repaired by loop erasure. The best individual ever seen is
 * returned, not only the final generation's best.
 */
@Slf4j
public final class GeneticSolver implements PathSolver {
    private static final Comparator<Individual> BY_FITNESS = Comparator.comparingDouble(Individual::fitness);

    private final GeneticParams params;

    public GeneticSolver() {
        this(GeneticParams.defaults());
    }

    public GeneticSolver(GeneticParams params) {
        this.params = Objects.requireNonNull(params, "params").validate();
    }

    @Override
    public SolverResult solve(SearchProblem problem, SearchCancellation cancellation) {
        NetworkGraph filtered = problem.filteredGraph();
        int source = problem.source();
        int target = problem.target();
        if (!ShortestPathSearch.isReachable(filtered, source, target)) {
            return SolverResult.failure(
                    FailureReason.INFEASIBLE_DEMAND,
                    "no path with bandwidth >= " + problem.bandwidthDemand()
            );
        }
        if (cancellation.isCancelled()) {
            return SolverResult.failure(FailureReason.CANCELLED, "cancelled before seeding");
        }

        Random random = PathSolver.randomFor(params);
        CostModel costModel = new CostModel(problem.weights(), params.getReliabilityScale());
        Run run = new Run(filtered, costModel, source, target, random);

        Individual[] population = run.seedPopulation();
        int initialSize = population.length;
        if (initialSize == 0) {
            return SolverResult.failure(
                    FailureReason.NO_PATH_FOUND,
                    "seeding produced no path within " + params.getPopulationSize() * params.getSeedingAttemptFactor() + " attempts"
            );
        }
        log.debug("GA seeded {} individuals (requested {})", initialSize, params.getPopulationSize());

        Individual best = fittest(population);
        DoubleArrayList bestHistory = new DoubleArrayList(params.getGenerations());
        DoubleArrayList generationHistory = new DoubleArrayList(params.getGenerations());
        int generation = 0;
        boolean cancelled = false;
        for (; generation < params.getGenerations(); generation++) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            population = run.nextGeneration(population);
            Individual current = fittest(population);
            if (current.fitness() < best.fitness()) {
                best = current;
            }
            generationHistory.add(current.fitness());
            bestHistory.add(best.fitness());
        }

        log.debug("GA finished after {} generations, best fitness {}", generation, best.fitness());
        GeneticTrace trace = new GeneticTrace(bestHistory, generationHistory, generation, initialSize, cancelled);
        return SolverResult.success(best.path(), costModel.evaluate(filtered, best.path()), trace);
    }

    private static Individual fittest(Individual[] population) {
        Individual best = population[0];
        for (int i = 1; i < population.length; i++) {
            if (population[i].fitness() < best.fitness()) {
                best = population[i];
            }
        }
        return best;
    }

    /**
     * Per-call scratch state.
     */
    private final class Run {
        private final NetworkGraph graph;
        private final CostModel costModel;
        private final int source;
        private final int target;
        private final Random random;

        private Run(NetworkGraph graph, CostModel costModel, int source, int target, Random random) {
            this.graph = graph;
            this.costModel = costModel;
            this.source = source;
            this.target = target;
            this.random = random;
        }

        /**
         * Collects up to {@code populationSize} distinct random walks.
         */
        Individual[] seedPopulation() {
            int capacity = params.getPopulationSize();
            int maxAttempts = capacity * params.getSeedingAttemptFactor();
            Individual[] population = new Individual[capacity];
            Set<String> signatures = new ObjectOpenHashSet<>();
            int size = 0;
            for (int attempt = 0; attempt < maxAttempts && size < capacity; attempt++) {
                int[] path = walk(source, target);
                if (path.length >= 2 && signatures.add(Paths.signature(path))) {
                    population[size++] = individual(path);
                }
            }
            return Arrays.copyOf(population, size);
        }

        Individual[] nextGeneration(Individual[] population) {
            int capacity = params.getPopulationSize();
            Individual[] next = new Individual[capacity];
            Individual[] sorted = population.clone();
            Arrays.sort(sorted, BY_FITNESS);
            int size = Math.min(params.getEliteCount(), sorted.length);
            System.arraycopy(sorted, 0, next, 0, size);

            while (size < capacity) {
                Individual p1 = tournament(population);
                Individual p2 = tournament(population);
                Individual child;
                if (random.nextDouble() < params.getCrossoverRate()) {
                    child = crossover(p1, p2);
                } else {
                    child = fitter(p1, p2);
                }
                if (random.nextDouble() < params.getMutationRate()) {
                    child = mutate(child);
                }
                next[size++] = child;
            }
            return next;
        }

        /**
         * Samples {@code tournamentSize} distinct individuals and keeps the fittest.
         */
        Individual tournament(Individual[] population) {
            int k = Math.min(params.getTournamentSize(), population.length);
            int[] order = new int[population.length];
            for (int i = 0; i < order.length; i++) {
                order[i] = i;
            }
            Individual best = null;
            for (int i = 0; i < k; i++) {
                int j = i + random.nextInt(order.length - i);
                int tmp = order[i];
                order[i] = order[j];
                order[j] = tmp;
                Individual candidate = population[order[i]];
                if (best == null || candidate.fitness() < best.fitness()) {
                    best = candidate;
                }
            }
            return best;
        }

        /**
         * Splices {@code p1} up to a shared interior node with {@code p2} after it.
         * Without a shared interior node the fitter parent is copied.
         */
        Individual crossover(Individual p1, Individual p2) {
            int[] a = p1.path();
            int[] b = p2.path();
            IntOpenHashSet interiorOfB = new IntOpenHashSet();
            for (int i = 1; i < b.length - 1; i++) {
                interiorOfB.add(b[i]);
            }
            IntArrayList common = new IntArrayList();
            for (int i = 1; i < a.length - 1; i++) {
                if (interiorOfB.contains(a[i])) {
                    common.add(a[i]);
                }
            }
            if (common.isEmpty()) {
                return fitter(p1, p2);
            }
            int pivot = common.getInt(random.nextInt(common.size()));
            int i1 = indexOf(a, pivot);
            int i2 = indexOf(b, pivot);
            int[] child = new int[i1 + 1 + b.length - i2 - 1];
            System.arraycopy(a, 0, child, 0, i1 + 1);
            System.arraycopy(b, i2 + 1, child, i1 + 1, b.length - i2 - 1);
            return repaired(child, p1, p2);
        }

        /**
         * Replaces one interior node with a random sub-path between its neighbors.
         * Falls back to the unmutated individual when no sub-path is found.
         */
        Individual mutate(Individual individual) {
            int[] path = individual.path();
            if (path.length < 3) {
                return individual;
            }
            int idx = 1 + random.nextInt(path.length - 2);
            int[] detour = walk(path[idx - 1], path[idx + 1]);
            if (detour.length < 2) {
                return individual;
            }
            int[] head = Arrays.copyOf(path, idx);
            int[] tail = Arrays.copyOfRange(path, idx + 1, path.length);
            int[] mutated = Paths.concat(Paths.concat(head, detour), tail);
            return repaired(mutated, individual, individual);
        }

        private Individual repaired(int[] candidate, Individual fallbackA, Individual fallbackB) {
            int[] simple = Paths.isSimple(candidate) ? candidate : Paths.eraseLoops(candidate);
            Individual child = individual(simple);
            if (Double.isInfinite(child.fitness())) {
                return fitter(fallbackA, fallbackB);
            }
            return child;
        }

        private Individual fitter(Individual a, Individual b) {
            return b.fitness() < a.fitness() ? b : a;
        }

        private Individual individual(int[] path) {
            return new Individual(path, costModel.fitness(graph, path));
        }

        private int[] walk(int from, int to) {
            return RandomWalkSearch.walk(
                    graph,
                    from,
                    to,
                    params.getMaxWalkLength(),
                    params.getWalkExpansionBudget(),
                    random
            );
        }

        private int indexOf(int[] path, int node) {
            for (int i = 0; i < path.length; i++) {
                if (path[i] == node) {
                    return i;
                }
            }
            return -1;
        }
    }
}
