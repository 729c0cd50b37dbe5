package com.seat.exchange.dto;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.graph.SimpleDirectedWeightedGraph;

import java.util.List;

/**
 * Directed benefit matrix over a ticket pool; {@code weight(i, j)} is the benefit of ticket i taking ticket j's seats.
 */
public final class BenefitGraph {
    private final List<String> ticketIds;
    private final double[][] weights;

    public BenefitGraph(List<String> ticketIds, double[][] weights) {
        if (weights.length != ticketIds.size()) {
            throw new IllegalArgumentException("Weight matrix size " + weights.length
                    + " does not match " + ticketIds.size() + " tickets");
        }
        this.ticketIds = List.copyOf(ticketIds);
        this.weights = new double[weights.length][];
        for (int i = 0; i < weights.length; i++) {
            if (weights[i].length != weights.length) {
                throw new IllegalArgumentException("Weight matrix row " + i + " is not square");
            }
            this.weights[i] = weights[i].clone();
        }
    }

    public int size() {
        return ticketIds.size();
    }

    public String ticketId(int index) {
        return ticketIds.get(index);
    }

    public List<String> getTicketIds() {
        return ticketIds;
    }

    public double weight(int from, int to) {
        return from == to ? 0.0 : weights[from][to];
    }

    /**
     * The graph restricted to its first {@code limit} tickets.
     */
    public BenefitGraph head(int limit) {
        if (limit >= size()) {
            return this;
        }
        double[][] sub = new double[limit][limit];
        for (int i = 0; i < limit; i++) {
            System.arraycopy(weights[i], 0, sub[i], 0, limit);
        }
        return new BenefitGraph(ticketIds.subList(0, limit), sub);
    }

    public boolean hasPositiveEdge() {
        for (int i = 0; i < weights.length; i++) {
            for (int j = 0; j < weights.length; j++) {
                if (i != j && weights[i][j] > 0) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Graph of ticket indexes holding only the positive-weight edges.
     */
    public Graph<Integer, DefaultWeightedEdge> toDirectedGraph() {
        Graph<Integer, DefaultWeightedEdge> graph = new SimpleDirectedWeightedGraph<>(DefaultWeightedEdge.class);
        for (int i = 0; i < size(); i++) {
            graph.addVertex(i);
        }
        for (int i = 0; i < size(); i++) {
            for (int j = 0; j < size(); j++) {
                if (i != j && weights[i][j] > 0) {
                    DefaultWeightedEdge edge = graph.addEdge(i, j);
                    graph.setEdgeWeight(edge, weights[i][j]);
                }
            }
        }
        return graph;
    }
}
