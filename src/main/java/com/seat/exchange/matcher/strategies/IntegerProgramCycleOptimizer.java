package com.seat.exchange.matcher.strategies;

import com.seat.exchange.dto.BenefitGraph;
import com.seat.exchange.dto.ExchangeCycle;
import lombok.extern.slf4j.Slf4j;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * Maximum-weight disjoint cycle cover as a binary program.
 * <p>
 * One binary variable per positive edge; each ticket keeps at most one outgoing and one incoming
 * selected edge, and the two counts must be equal so every selected edge closes into a cycle.
 * Weights are scaled by {@link #SCALE} and rounded so the objective stays integral.
 * </p>
 */
@Slf4j
public class IntegerProgramCycleOptimizer implements CycleOptimizer {
    static final int SCALE = 10;

    @Override
    public List<ExchangeCycle> optimize(BenefitGraph graph, Duration timeLimit) {
        int n = graph.size();
        Graph<Integer, DefaultWeightedEdge> benefitEdges = graph.toDirectedGraph();
        List<int[]> edges = new ArrayList<>();
        List<Long> scaledWeights = new ArrayList<>();
        for (DefaultWeightedEdge edge : benefitEdges.edgeSet()) {
            long scaled = Math.round(benefitEdges.getEdgeWeight(edge) * SCALE);
            // weights below 1/SCALE round away
            if (scaled > 0) {
                edges.add(new int[]{benefitEdges.getEdgeSource(edge), benefitEdges.getEdgeTarget(edge)});
                scaledWeights.add(scaled);
            }
        }
        if (edges.isEmpty()) {
            log.info("No positive benefit edge among {} tickets, skipping solve", n);
            return Collections.emptyList();
        }

        ExpressionsBasedModel model = new ExpressionsBasedModel();
        Variable[] vars = new Variable[edges.size()];
        for (int e = 0; e < edges.size(); e++) {
            int[] edge = edges.get(e);
            vars[e] = model.newVariable("x_" + edge[0] + "_" + edge[1])
                    .binary()
                    .weight(BigDecimal.valueOf(scaledWeights.get(e)));
        }

        Expression[] out = new Expression[n];
        Expression[] in = new Expression[n];
        Expression[] balance = new Expression[n];
        for (int v = 0; v < n; v++) {
            out[v] = model.newExpression("out_" + v).upper(BigDecimal.ONE);
            in[v] = model.newExpression("in_" + v).upper(BigDecimal.ONE);
            balance[v] = model.newExpression("balance_" + v).level(BigDecimal.ZERO);
        }
        for (int e = 0; e < edges.size(); e++) {
            int from = edges.get(e)[0];
            int to = edges.get(e)[1];
            out[from].set(vars[e], BigDecimal.ONE);
            in[to].set(vars[e], BigDecimal.ONE);
            balance[from].set(vars[e], BigDecimal.ONE);
            balance[to].set(vars[e], BigDecimal.ONE.negate());
        }

        long limitMillis = Math.max(1L, timeLimit.toMillis());
        model.options.time_abort = limitMillis;
        model.options.time_suffice = limitMillis;

        Optimisation.Result result = model.maximise();
        Optimisation.State state = result.getState();
        if (!state.isOptimal() && !state.isFeasible()) {
            log.warn("Cycle program ended in state {} for {} tickets, returning no cycles", state, n);
            return Collections.emptyList();
        }

        int[] successor = new int[n];
        long[] successorWeight = new long[n];
        Arrays.fill(successor, -1);
        for (int e = 0; e < edges.size(); e++) {
            if (result.get(e).compareTo(BigDecimal.valueOf(0.5)) > 0) {
                successor[edges.get(e)[0]] = edges.get(e)[1];
                successorWeight[edges.get(e)[0]] = scaledWeights.get(e);
            }
        }

        List<ExchangeCycle> cycles = decode(graph, successor, successorWeight);
        log.info("Cycle program solved: state={}, tickets={}, edges={}, cycles={}", state, n, edges.size(), cycles.size());
        return cycles;
    }

    static List<ExchangeCycle> decode(BenefitGraph graph, int[] successor, long[] successorWeight) {
        int n = successor.length;
        boolean[] visited = new boolean[n];
        List<ExchangeCycle> cycles = new ArrayList<>();

        for (int start = 0; start < n; start++) {
            if (visited[start] || successor[start] < 0) {
                continue;
            }
            List<String> members = new ArrayList<>();
            long total = 0;
            int current = start;
            boolean closed = false;
            while (true) {
                visited[current] = true;
                members.add(graph.ticketId(current));
                int next = successor[current];
                if (next < 0) {
                    break;
                }
                total += successorWeight[current];
                if (next == start) {
                    closed = true;
                    break;
                }
                if (visited[next]) {
                    break;
                }
                current = next;
            }
            if (closed) {
                cycles.add(ExchangeCycle.of(members, (double) total / SCALE));
            } else {
                log.debug("Dropping open walk from ticket {}", graph.ticketId(start));
            }
        }
        return cycles;
    }

    @Override
    public String backendName() {
        return "ilp";
    }
}
