package org.qosroute.app;

import org.qosroute.routing.core.Demand;
import org.qosroute.routing.core.RouteDispatcher;
import org.qosroute.routing.core.RouteResult;
import org.qosroute.routing.core.RoutingAlgorithm;
import org.qosroute.routing.cost.QosWeights;
import org.qosroute.routing.graph.LinkType;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.solver.SolverParameters;
import org.qosroute.routing.solver.annealing.AnnealingParams;
import org.qosroute.routing.solver.genetic.GeneticParams;
import org.qosroute.routing.solver.qlearning.QLearningParams;
import org.qosroute.routing.solver.swarm.SwarmParams;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Demo entry point: compares every algorithm on a small sample topology.
 */
public class Main {
    private static final long DEMO_SEED = 42L;

    /**
     * Usage: {@code Main [source target bandwidth]}, defaults to {@code 1 6 200}.
     *
     * @param args optional demand override.
     */
    public static void main(String[] args) {
        Demand demand = args.length >= 3
                ? Demand.of(Integer.parseInt(args[0]), Integer.parseInt(args[1]), Double.parseDouble(args[2]))
                : Demand.of(1, 6, 200.0d);
        QosWeights weights = QosWeights.of(0.4d, 0.4d, 0.2d);

        Map<RoutingAlgorithm, SolverParameters> params = new EnumMap<>(RoutingAlgorithm.class);
        params.put(RoutingAlgorithm.GENETIC, GeneticParams.defaults().toBuilder().seed(DEMO_SEED).build());
        params.put(RoutingAlgorithm.PARTICLE_SWARM, SwarmParams.defaults().toBuilder().seed(DEMO_SEED).build());
        params.put(RoutingAlgorithm.SIMULATED_ANNEALING, AnnealingParams.defaults().toBuilder().seed(DEMO_SEED).build());
        params.put(RoutingAlgorithm.Q_LEARNING, QLearningParams.defaults().toBuilder().seed(DEMO_SEED).build());

        Map<RoutingAlgorithm, RouteResult> results = new RouteDispatcher().compare(
                sampleTopology(),
                demand,
                weights,
                EnumSet.allOf(RoutingAlgorithm.class),
                params
        );

        System.out.printf(Locale.ROOT, "Demand %d -> %d, bandwidth %.1f Mbps%n",
                demand.source(), demand.target(), demand.bandwidth());
        for (Map.Entry<RoutingAlgorithm, RouteResult> entry : results.entrySet()) {
            System.out.println(describe(entry.getKey(), entry.getValue()));
        }
    }

    static String describe(RoutingAlgorithm algorithm, RouteResult result) {
        if (!result.isSuccess()) {
            return String.format(Locale.ROOT, "%-20s FAILED %s %s",
                    algorithm, result.getFailureReason(), result.getFailureDetail());
        }
        String path = result.getPath().stream().map(String::valueOf).collect(Collectors.joining(" -> "));
        return String.format(Locale.ROOT,
                "%-20s path %s | delay %.2f ms | reliability %.3f%% | resource %.2f | fitness %.3f",
                algorithm,
                path,
                result.getTotalDelay(),
                result.getFinalReliabilityPercent(),
                result.getResourceCost(),
                result.getFitness());
    }

    static NetworkGraph sampleTopology() {
        return NetworkGraph.builder()
                .addNode(1, 0.5d, 0.999d)
                .addNode(2, 1.2d, 0.98d)
                .addNode(3, 0.8d, 0.99d)
                .addNode(4, 1.5d, 0.97d)
                .addNode(5, 0.6d, 0.995d)
                .addNode(6, 0.7d, 0.999d)
                .addLink(1, 2, 900.0d, 2.0d, 0.93d, LinkType.FIBER)
                .addLink(2, 4, 850.0d, 3.0d, 0.92d, LinkType.FIBER)
                .addLink(1, 3, 400.0d, 6.0d, 0.96d, LinkType.MICROWAVE)
                .addLink(3, 4, 500.0d, 7.0d, 0.97d, LinkType.MICROWAVE)
                .addLink(4, 6, 1000.0d, 1.0d, 0.94d, LinkType.FIBER)
                .addLink(3, 5, 80.0d, 30.0d, 0.999d, LinkType.SATELLITE)
                .addLink(5, 6, 60.0d, 25.0d, 0.995d, LinkType.SATELLITE)
                .addLink(2, 5, 350.0d, 8.0d, 0.955d, LinkType.MICROWAVE)
                .build();
    }
}
