// This file is part of SatFusion.
// Copyright (C) 2026  The SatFusion Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.satfusion.query.resolver;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;

import net.satfusion.query.PipelineNode;

/**
 * Tracks which node produces each variable and which nodes consume it. 
 * Edges of the node graph point from producers to consumers. A variable is
 * either produced, and then maps to exactly one producer, or unresolved 
 * with the consumers that asked for it, never both.
 * <p>
 * The graph stays acyclic as a consumer can only be attached to variables
 * produced before it was added.
 * 
 * @since 1.0
 */
public class ProducerGraph {

  /** Variable to producer in registration order. */
  protected final Map<String, PipelineNode> producers;
  
  /** Variable to the nodes consuming it. */
  protected final SetMultimap<String, PipelineNode> consumers;
  
  /** Variable to the nodes that required it when it had no producer. */
  protected final SetMultimap<String, PipelineNode> unresolved;
  
  /** The node level graph, producers to consumers. */
  protected final MutableGraph<PipelineNode> graph;
  
  /** Default ctor. */
  public ProducerGraph() {
    producers = Maps.newLinkedHashMap();
    consumers = LinkedHashMultimap.create();
    unresolved = LinkedHashMultimap.create();
    graph = GraphBuilder.directed()
        .allowsSelfLoops(false)
        .build();
  }
  
  /**
   * @param variables A non-null list of variables.
   * @return True if all the variables have a producer.
   */
  public boolean isResolved(final List<String> variables) {
    return producers.keySet().containsAll(variables);
  }
  
  /**
   * @param variable A variable.
   * @return True if the variable has a producer.
   */
  public boolean isProduced(final String variable) {
    return producers.containsKey(variable);
  }
  
  /**
   * Registers the node as the producer of its variables that do not have a
   * producer yet. Variables already produced keep their producer.
   * @param node A non-null node.
   * @return The variables now produced by the node.
   */
  public List<String> addProducer(final PipelineNode node) {
    graph.addNode(node);
    final List<String> added = Lists.newArrayList();
    for (final String variable : node.variables()) {
      if (producers.containsKey(variable)) {
        continue;
      }
      producers.put(variable, node);
      added.add(variable);
      // produced and unresolved stay disjoint
      unresolved.removeAll(variable);
    }
    return added;
  }
  
  /**
   * Attaches the node as a consumer of its required variables. Variables
   * without a producer are recorded as unresolved.
   * @param node A non-null node.
   * @return True if every required variable was resolved.
   */
  public boolean addConsumer(final PipelineNode node) {
    return addConsumer(node, node.requiredVariables());
  }
  
  /**
   * Attaches the node as a consumer of the given variables.
   * @param node A non-null node.
   * @param variables The consumed variables.
   * @return True if every variable was resolved.
   */
  public boolean addConsumer(final PipelineNode node, 
                             final List<String> variables) {
    graph.addNode(node);
    boolean resolved = true;
    for (final String variable : variables) {
      final PipelineNode producer = producers.get(variable);
      if (producer == null) {
        unresolved.put(variable, node);
        resolved = false;
        continue;
      }
      consumers.put(variable, node);
      if (producer != node) {
        graph.putEdge(producer, node);
        if (Graphs.hasCycle(graph)) {
          throw new IllegalStateException("Cycle detected linking " 
              + producer.id() + " to " + node.id());
        }
      }
    }
    return resolved;
  }
  
  /**
   * Detaches the node as a consumer of all variables, resolved or not.
   * @param node A non-null node.
   */
  public void removeConsumer(final PipelineNode node) {
    for (final String variable : Lists.newArrayList(consumers.keySet())) {
      consumers.remove(variable, node);
    }
    for (final String variable : Lists.newArrayList(unresolved.keySet())) {
      unresolved.remove(variable, node);
    }
    if (graph.nodes().contains(node)) {
      for (final PipelineNode producer : 
          ImmutableList.copyOf(graph.predecessors(node))) {
        graph.removeEdge(producer, node);
      }
    }
  }
  
  /**
   * Removes the node completely: it is detached as a consumer and the 
   * variables it produces are unregistered.
   * @param node A non-null node.
   * @return The unregistered variables.
   */
  public List<String> removeNode(final PipelineNode node) {
    removeConsumer(node);
    final List<String> removed = Lists.newArrayList();
    for (final Entry<String, PipelineNode> entry : 
        Lists.newArrayList(producers.entrySet())) {
      if (entry.getValue() == node) {
        producers.remove(entry.getKey());
        consumers.removeAll(entry.getKey());
        removed.add(entry.getKey());
      }
    }
    graph.removeNode(node);
    return removed;
  }
  
  /**
   * @param node A node.
   * @return True if any variable produced by the node is consumed by 
   * another node.
   */
  public boolean isConsumed(final PipelineNode node) {
    for (final Entry<String, PipelineNode> entry : producers.entrySet()) {
      if (entry.getValue() != node) {
        continue;
      }
      for (final PipelineNode consumer : consumers.get(entry.getKey())) {
        if (consumer != node) {
          return true;
        }
      }
    }
    return false;
  }
  
  /** @return The nodes that required at least one unresolved variable. */
  public Set<PipelineNode> unresolvedConsumers() {
    return ImmutableSet.copyOf(unresolved.values());
  }
  
  /** @return The produced variables in registration order. */
  public List<String> available() {
    return ImmutableList.copyOf(producers.keySet());
  }
  
  /**
   * @param variable A variable.
   * @return The producer or null if unresolved.
   */
  public PipelineNode producer(final String variable) {
    return producers.get(variable);
  }
  
  /**
   * @param variable A variable.
   * @return The consumers of the variable, possibly empty.
   */
  public Set<PipelineNode> consumers(final String variable) {
    return ImmutableSet.copyOf(consumers.get(variable));
  }
  
  /** @return The unresolved variables. */
  public Set<String> unresolvedVariables() {
    return ImmutableSet.copyOf(unresolved.keySet());
  }
  
  /**
   * @param node A node of the graph.
   * @return The nodes consuming variables of the node.
   */
  public Set<PipelineNode> successors(final PipelineNode node) {
    if (!graph.nodes().contains(node)) {
      return ImmutableSet.of();
    }
    return ImmutableSet.copyOf(graph.successors(node));
  }
  
  /** @return The nodes of the graph. */
  public Set<PipelineNode> nodes() {
    return Sets.newLinkedHashSet(graph.nodes());
  }
}
