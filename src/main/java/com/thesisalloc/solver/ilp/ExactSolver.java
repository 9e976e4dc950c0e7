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

package com.thesisalloc.solver.ilp;

import com.google.ortools.Loader;
import com.google.ortools.modelbuilder.LinearExpr;
import com.google.ortools.modelbuilder.LinearExprBuilder;
import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.Variable;
import com.thesisalloc.config.AllocationConfig;
import com.thesisalloc.config.Algorithm;
import com.thesisalloc.config.CapacityConfig;
import com.thesisalloc.config.DeptMinMode;
import com.thesisalloc.config.SolverConfig;
import com.thesisalloc.diagnostics.SolveStatus;
import com.thesisalloc.diagnostics.TieDetector;
import com.thesisalloc.diagnostics.TieReport;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.solver.AbstractAllocationSolver;
import com.thesisalloc.solver.AllocationResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Exact allocation as a 0/1 integer program.
 *
 * <pre>
 *   min  sum cost[s,t] x[s,t] + P_topic sum ovT[t] + P_coach sum ovC[c] + P_dept sum short[d]
 *   s.t. sum_t x[s,t] == 1                           every assignable student s
 *        sum_s x[s,t] - ovT[t] <= cap[t]             every topic t
 *        sum_{s, t of c} x[s,t] - ovC[c] <= cap[c]   every coach c
 *        sum_{s, t of d} x[s,t] + short[d] >= min[d] every department d with min[d] > 0
 * </pre>
 *
 * Overflow variables exist only when the matching overflow toggle is on, shortfall variables only
 * in soft department-minimum mode.
 */
public final class ExactSolver extends AbstractAllocationSolver {
  private static final Logger logger = Logger.getLogger(ExactSolver.class.getName());

  private final IntegerProgramBackend backend;

  private ModelBuilder model;
  // x[s][i] is the variable of student s and topic costs.rowTopics(s)[i].
  private Variable[][] x;
  private LinearExpr objective;

  public ExactSolver(AllocationInput input, AllocationConfig config) {
    this(input, config, IntegerProgramBackends.create(config.getSolver().getIlpBackend()));
  }

  public ExactSolver(
      AllocationInput input, AllocationConfig config, IntegerProgramBackend backend) {
    super(input, config);
    this.backend = backend;
  }

  @Override
  public Algorithm algorithm() {
    return Algorithm.ILP;
  }

  /** The formulated model, or null before {@link #build()}. */
  public ModelBuilder getModel() {
    return model;
  }

  @Override
  protected void buildModel() {
    Loader.loadNativeLibraries();
    final CapacityConfig capacityConfig = capacities.getConfig();
    model = new ModelBuilder();
    model.setName("thesis_allocation");
    LinearExprBuilder goal = LinearExpr.newBuilder();

    // Decision variables, also bucketed per topic for the capacity rows.
    final int numTopics = costs.numTopics();
    List<List<Variable>> byTopic = new ArrayList<>(numTopics);
    for (int t = 0; t < numTopics; ++t) {
      byTopic.add(new ArrayList<>());
    }
    x = new Variable[costs.numStudents()][];
    for (int s = 0; s < costs.numStudents(); ++s) {
      int[] topics = costs.rowTopics(s);
      int[] rowCosts = costs.rowCosts(s);
      x[s] = new Variable[topics.length];
      for (int i = 0; i < topics.length; ++i) {
        Variable var =
            model.newBoolVar(
                "x[" + costs.student(s).getId() + "," + costs.topic(topics[i]).getId() + "]");
        x[s][i] = var;
        byTopic.get(topics[i]).add(var);
        goal.addTerm(var, rowCosts[i]);
      }
    }

    // No slack can usefully exceed the number of students that can be placed.
    final double slackBound = costs.numAssignableStudents();

    Variable[] topicOverflow = null;
    if (capacities.isTopicOverflowEnabled()) {
      topicOverflow = new Variable[numTopics];
      for (int t = 0; t < numTopics; ++t) {
        topicOverflow[t] =
            model.newIntVar(0, slackBound, "ov_topic[" + costs.topic(t).getId() + "]");
        goal.addTerm(topicOverflow[t], capacityConfig.getTopicOverflowPenalty());
      }
    }
    Variable[] coachOverflow = null;
    if (capacities.isCoachOverflowEnabled()) {
      coachOverflow = new Variable[capacities.numCoaches()];
      for (int c = 0; c < capacities.numCoaches(); ++c) {
        coachOverflow[c] =
            model.newIntVar(0, slackBound, "ov_coach[" + capacities.coach(c).getId() + "]");
        goal.addTerm(coachOverflow[c], capacityConfig.getCoachOverflowPenalty());
      }
    }
    final boolean softMinimum = capacities.getDeptMinMode() == DeptMinMode.SOFT;
    Variable[] shortfall = new Variable[capacities.numDepartments()];
    if (softMinimum) {
      for (int d = 0; d < capacities.numDepartments(); ++d) {
        int minimum = capacities.departmentMinimum(d);
        if (minimum > 0) {
          shortfall[d] =
              model.newIntVar(0, minimum, "shortfall[" + capacities.department(d).getId() + "]");
          goal.addTerm(shortfall[d], capacityConfig.getDeptShortfallPenalty());
        }
      }
    }

    objective = goal.build();
    model.minimize(objective);

    // Exactly one topic per assignable student.
    for (int s = 0; s < costs.numStudents(); ++s) {
      if (costs.isUnassignable(s)) {
        continue;
      }
      model
          .addEquality(LinearExpr.sum(x[s]), 1)
          .withName("one_topic[" + costs.student(s).getId() + "]");
    }

    // Topic capacities.
    for (int t = 0; t < numTopics; ++t) {
      LinearExprBuilder lhs = LinearExpr.newBuilder();
      for (Variable var : byTopic.get(t)) {
        lhs.add(var);
      }
      if (topicOverflow != null) {
        lhs.addTerm(topicOverflow[t], -1);
      }
      model
          .addLessOrEqual(lhs, capacities.topicCapacity(t))
          .withName("topic_cap[" + costs.topic(t).getId() + "]");
    }

    // Coach capacities over all topics of the coach.
    for (int c = 0; c < capacities.numCoaches(); ++c) {
      LinearExprBuilder lhs = LinearExpr.newBuilder();
      for (int t : capacities.coachTopics(c)) {
        for (Variable var : byTopic.get(t)) {
          lhs.add(var);
        }
      }
      if (coachOverflow != null) {
        lhs.addTerm(coachOverflow[c], -1);
      }
      model
          .addLessOrEqual(lhs, capacities.coachCapacity(c))
          .withName("coach_cap[" + capacities.coach(c).getId() + "]");
    }

    // Department minimums.
    for (int d = 0; d < capacities.numDepartments(); ++d) {
      int minimum = capacities.departmentMinimum(d);
      if (minimum <= 0) {
        continue;
      }
      LinearExprBuilder lhs = LinearExpr.newBuilder();
      for (int t : capacities.departmentTopics(d)) {
        for (Variable var : byTopic.get(t)) {
          lhs.add(var);
        }
      }
      String id = capacities.department(d).getId();
      if (softMinimum) {
        lhs.add(shortfall[d]);
        model.addGreaterOrEqual(lhs, minimum).withName("dept_min_soft[" + id + "]");
      } else {
        model.addGreaterOrEqual(lhs, minimum).withName("dept_min_hard[" + id + "]");
      }
    }

    logger.info(
        "Built integer program: " + model.numVariables() + " variables, "
            + model.numConstraints() + " constraints");
  }

  @Override
  protected AllocationResult solveModel() {
    final SolverConfig solverConfig = config.getSolver();
    logger.info("Solving integer program with " + backend.name());
    IntegerProgramSolution solution = backend.solve(model, solverConfig);
    logger.info("Integer program status: " + solution.getStatus().getLabel());

    if (solverConfig.getEpsilonSuboptimal().isPresent()
        && solution.getStatus() == SolveStatus.OPTIMAL) {
      solution = resolveNearOptimal(solution, solverConfig);
    }

    int[] assignedTopic = new int[costs.numStudents()];
    Arrays.fill(assignedTopic, -1);
    List<TieReport> ties = Collections.emptyList();
    double objectiveValue = Double.NaN;
    if (solution.hasSolution()) {
      for (int s = 0; s < costs.numStudents(); ++s) {
        int[] topics = costs.rowTopics(s);
        for (int i = 0; i < topics.length; ++i) {
          if (solution.value(x[s][i]) == 1) {
            assignedTopic[s] = topics[i];
            break;
          }
        }
      }
      objectiveValue = solution.getObjectiveValue();
      ties = TieDetector.detect(costs, assignedTopic);
      if (!ties.isEmpty()) {
        logger.info(ties.size() + " student(s) have equally good alternatives");
      }
    }
    return toResult(assignedTopic, solution.getStatus(), objectiveValue, ties);
  }

  /**
   * Re-solves the same objective on a clone of the model bounded by {@code objective <= optimum +
   * floor(epsilon * |optimum|)}. The absolute value departs from a plain {@code (1 + epsilon) *
   * optimum} bound on purpose: a forced assignment can make the optimum negative, and scaling a
   * negative optimum would cut it off and make the re-solve infeasible. The bound keeps the optimum
   * feasible, so the backend may well return the same solution again.
   */
  private IntegerProgramSolution resolveNearOptimal(
      IntegerProgramSolution optimal, SolverConfig solverConfig) {
    double epsilon = solverConfig.getEpsilonSuboptimal().getAsDouble();
    long optimum = Math.round(optimal.getObjectiveValue());
    long bound = optimum + (long) Math.floor(epsilon * Math.abs(optimum));
    ModelBuilder bounded = model.getClone();
    bounded.addLessOrEqual(objective, bound).withName("epsilon_suboptimal");
    logger.info("Re-solving with objective <= " + bound + " (epsilon=" + epsilon + ")");
    IntegerProgramSolution resolved = backend.solve(bounded, solverConfig);
    if (!resolved.hasSolution()) {
      logger.warning(
          "Near-optimal re-solve returned " + resolved.getStatus().getLabel()
              + ", keeping the optimal solution");
      return optimal;
    }
    return resolved;
  }
}
