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

import com.thesisalloc.config.AllocationConfig;
import com.thesisalloc.config.Algorithm;
import com.thesisalloc.diagnostics.SolveStatus;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.solver.AbstractAllocationSolver;
import com.thesisalloc.solver.AllocationResult;
import java.util.Arrays;
import java.util.Collections;
import java.util.logging.Logger;

/**
 * Approximate allocation as a min-cost maximum flow with hard capacities.
 *
 * <p>Layers: source, one node per assignable student (capacity 1), one node per topic (an arc per
 * admissible pair, capacity 1, unit cost = pair cost), one node per coach (an arc per topic with
 * the topic capacity) and the sink (an arc per coach with the coach capacity). Overflow toggles
 * and department minimums are not modelled.
 */
public final class FlowSolver extends AbstractAllocationSolver {
  private static final Logger logger = Logger.getLogger(FlowSolver.class.getName());

  private MinCostFlowNetwork network;
  private int source;
  private int sink;
  // Arc indices of the student -> topic layer, parallel to costs.rowTopics(s).
  private int[][] pairArcs;

  public FlowSolver(AllocationInput input, AllocationConfig config) {
    super(input, config);
  }

  @Override
  public Algorithm algorithm() {
    return Algorithm.FLOW;
  }

  /** The built network, or null before {@link #build()}. */
  public MinCostFlowNetwork getNetwork() {
    return network;
  }

  @Override
  protected void buildModel() {
    final int numStudents = costs.numStudents();
    final int numTopics = costs.numTopics();
    final int numCoaches = capacities.numCoaches();
    final int firstStudent = 1;
    final int firstTopic = firstStudent + numStudents;
    final int firstCoach = firstTopic + numTopics;
    source = 0;
    sink = firstCoach + numCoaches;
    network = new MinCostFlowNetwork(sink + 1);

    pairArcs = new int[numStudents][];
    for (int s = 0; s < numStudents; ++s) {
      int[] topics = costs.rowTopics(s);
      int[] rowCosts = costs.rowCosts(s);
      pairArcs[s] = new int[topics.length];
      if (topics.length == 0) {
        continue;
      }
      network.addArcWithCapacityAndUnitCost(source, firstStudent + s, 1, 0);
      for (int i = 0; i < topics.length; ++i) {
        pairArcs[s][i] =
            network.addArcWithCapacityAndUnitCost(
                firstStudent + s, firstTopic + topics[i], 1, rowCosts[i]);
      }
    }
    for (int t = 0; t < numTopics; ++t) {
      network.addArcWithCapacityAndUnitCost(
          firstTopic + t, firstCoach + capacities.topicCoach(t), capacities.topicCapacity(t), 0);
    }
    for (int c = 0; c < numCoaches; ++c) {
      network.addArcWithCapacityAndUnitCost(firstCoach + c, sink, capacities.coachCapacity(c), 0);
    }
    logger.info(
        "Built flow network: " + network.getNumNodes() + " nodes, " + network.getNumArcs()
            + " arcs");
  }

  @Override
  protected AllocationResult solveModel() {
    MinCostFlowNetwork.Status flowStatus = network.solveMaxFlowWithMinCost(source, sink);
    int[] assignedTopic = new int[costs.numStudents()];
    Arrays.fill(assignedTopic, -1);
    if (flowStatus != MinCostFlowNetwork.Status.OPTIMAL) {
      logger.severe("Min-cost flow failed with status " + flowStatus);
      return toResult(assignedTopic, SolveStatus.ABNORMAL, Double.NaN, Collections.emptyList());
    }

    for (int s = 0; s < costs.numStudents(); ++s) {
      int[] topics = costs.rowTopics(s);
      for (int i = 0; i < topics.length; ++i) {
        if (network.getFlow(pairArcs[s][i]) > 0) {
          assignedTopic[s] = topics[i];
          break;
        }
      }
    }

    long routed = network.getOptimalFlow();
    int assignable = costs.numAssignableStudents();
    SolveStatus status = routed == assignable ? SolveStatus.OPTIMAL : SolveStatus.PARTIAL;
    if (status == SolveStatus.PARTIAL) {
      logger.warning(
          "Flow routed " + routed + " of " + assignable
              + " assignable students; capacities are too tight for the rest");
    }
    logger.info("Flow status: " + status.getLabel() + ", cost " + network.getOptimalCost());
    return toResult(
        assignedTopic, status, (double) network.getOptimalCost(), Collections.emptyList());
  }
}
