// Copyright 2010-2021 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.thesisalloc.solver.flow;

import java.util.Arrays;
import java.util.PriorityQueue;

/**
 * Integer-indexed directed network solved for a maximum flow of minimum cost.
 *
 * <p>Arcs are added with {@link #addArcWithCapacityAndUnitCost} and keep the index returned at
 * insertion time. The solver runs successive shortest augmenting paths: Bellman-Ford computes the
 * initial node potentials, so unit costs may be negative as long as the network has no negative
 * cycle, then every augmentation uses Dijkstra on reduced costs.
 */
public final class MinCostFlowNetwork {
  /** Result of {@link #solveMaxFlowWithMinCost(int, int)}. */
  public enum Status {
    NOT_SOLVED,
    OPTIMAL,
    BAD_COST_RANGE
  }

  private static final long INFINITY = Long.MAX_VALUE / 4;

  private final int numNodes;
  // Residual arcs: 2 * arc is the forward arc, 2 * arc + 1 its reverse.
  private int[] to = new int[16];
  private int[] next = new int[16];
  private long[] residual = new long[16];
  private long[] cost = new long[16];
  private long[] capacity = new long[8];
  private final int[] firstArc;
  private int numArcs;

  private long optimalFlow;
  private long optimalCost;
  private Status status = Status.NOT_SOLVED;

  public MinCostFlowNetwork(int numNodes) {
    if (numNodes < 0) {
      throw new IllegalArgumentException("numNodes must be non-negative, got " + numNodes);
    }
    this.numNodes = numNodes;
    this.firstArc = new int[numNodes];
    Arrays.fill(firstArc, -1);
  }

  public int getNumNodes() {
    return numNodes;
  }

  public int getNumArcs() {
    return numArcs;
  }

  /** Adds an arc and returns its index; indices are dense and start at 0. */
  public int addArcWithCapacityAndUnitCost(int tail, int head, long arcCapacity, long unitCost) {
    checkNode(tail);
    checkNode(head);
    if (arcCapacity < 0) {
      throw new IllegalArgumentException("capacity must be non-negative, got " + arcCapacity);
    }
    int arc = numArcs++;
    ensureArcCapacity(numArcs);
    capacity[arc] = arcCapacity;
    link(2 * arc, tail, head, arcCapacity, unitCost);
    link(2 * arc + 1, head, tail, 0, -unitCost);
    status = Status.NOT_SOLVED;
    return arc;
  }

  private void link(int residualArc, int tail, int head, long arcCapacity, long unitCost) {
    to[residualArc] = head;
    residual[residualArc] = arcCapacity;
    cost[residualArc] = unitCost;
    next[residualArc] = firstArc[tail];
    firstArc[tail] = residualArc;
  }

  private void ensureArcCapacity(int arcs) {
    if (arcs > capacity.length) {
      int size = Math.max(arcs, 2 * capacity.length);
      capacity = Arrays.copyOf(capacity, size);
      to = Arrays.copyOf(to, 2 * size);
      next = Arrays.copyOf(next, 2 * size);
      residual = Arrays.copyOf(residual, 2 * size);
      cost = Arrays.copyOf(cost, 2 * size);
    }
  }

  private void checkNode(int node) {
    if (node < 0 || node >= numNodes) {
      throw new IndexOutOfBoundsException("node " + node + " not in [0, " + numNodes + ")");
    }
  }

  public int getTail(int arc) {
    return to[2 * arc + 1];
  }

  public int getHead(int arc) {
    return to[2 * arc];
  }

  public long getCapacity(int arc) {
    return capacity[arc];
  }

  public long getUnitCost(int arc) {
    return cost[2 * arc];
  }

  /** Flow on {@code arc} after the last solve. */
  public long getFlow(int arc) {
    return residual[2 * arc + 1];
  }

  public long getOptimalFlow() {
    return optimalFlow;
  }

  /** Sum of unit cost times flow over all arcs. */
  public long getOptimalCost() {
    return optimalCost;
  }

  public Status getStatus() {
    return status;
  }

  /**
   * Pushes as much flow as possible from {@code source} to {@code sink}, at minimum total cost
   * among all maximum flows. Any flow from a previous solve is discarded first.
   */
  public Status solveMaxFlowWithMinCost(int source, int sink) {
    checkNode(source);
    checkNode(sink);
    for (int arc = 0; arc < numArcs; ++arc) {
      residual[2 * arc] = capacity[arc];
      residual[2 * arc + 1] = 0;
    }
    optimalFlow = 0;
    optimalCost = 0;
    if (source == sink) {
      status = Status.OPTIMAL;
      return status;
    }

    long[] potential = new long[numNodes];
    if (!initialPotentials(source, potential)) {
      status = Status.BAD_COST_RANGE;
      return status;
    }

    long[] distance = new long[numNodes];
    int[] parentArc = new int[numNodes];
    while (shortestPath(source, potential, distance, parentArc)) {
      if (distance[sink] >= INFINITY) {
        break;
      }
      for (int node = 0; node < numNodes; ++node) {
        if (distance[node] < INFINITY) {
          potential[node] += distance[node];
        }
      }

      long push = INFINITY;
      for (int node = sink; node != source; node = to[parentArc[node] ^ 1]) {
        push = Math.min(push, residual[parentArc[node]]);
      }
      for (int node = sink; node != source; node = to[parentArc[node] ^ 1]) {
        int residualArc = parentArc[node];
        residual[residualArc] -= push;
        residual[residualArc ^ 1] += push;
        optimalCost += push * cost[residualArc];
      }
      optimalFlow += push;
    }
    status = Status.OPTIMAL;
    return status;
  }

  /**
   * Bellman-Ford from {@code source} over arcs with positive residual capacity. Nodes that cannot
   * be reached keep potential 0. Returns false on a negative cycle.
   */
  private boolean initialPotentials(int source, long[] potential) {
    long[] distance = new long[numNodes];
    Arrays.fill(distance, INFINITY);
    distance[source] = 0;
    for (int round = 0; round < numNodes; ++round) {
      boolean changed = false;
      for (int node = 0; node < numNodes; ++node) {
        if (distance[node] >= INFINITY) {
          continue;
        }
        for (int a = firstArc[node]; a != -1; a = next[a]) {
          if (residual[a] > 0 && distance[node] + cost[a] < distance[to[a]]) {
            distance[to[a]] = distance[node] + cost[a];
            changed = true;
          }
        }
      }
      if (!changed) {
        for (int node = 0; node < numNodes; ++node) {
          potential[node] = distance[node] < INFINITY ? distance[node] : 0;
        }
        return true;
      }
    }
    return false;
  }

  /**
   * Dijkstra on reduced costs. Fills {@code distance} (INFINITY when unreachable) and {@code
   * parentArc}; returns false if nothing beyond the source is reachable.
   */
  private boolean shortestPath(int source, long[] potential, long[] distance, int[] parentArc) {
    Arrays.fill(distance, INFINITY);
    Arrays.fill(parentArc, -1);
    distance[source] = 0;
    PriorityQueue<long[]> queue = new PriorityQueue<>((a, b) -> Long.compare(a[0], b[0]));
    queue.add(new long[] {0, source});
    boolean reachedAny = false;
    while (!queue.isEmpty()) {
      long[] entry = queue.poll();
      int node = (int) entry[1];
      if (entry[0] > distance[node]) {
        continue;
      }
      for (int a = firstArc[node]; a != -1; a = next[a]) {
        if (residual[a] <= 0) {
          continue;
        }
        int head = to[a];
        long reduced = cost[a] + potential[node] - potential[head];
        long candidate = distance[node] + reduced;
        if (candidate < distance[head]) {
          distance[head] = candidate;
          parentArc[head] = a;
          queue.add(new long[] {candidate, head});
          reachedAny = true;
        }
      }
    }
    return reachedAny;
  }
}
