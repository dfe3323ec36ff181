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

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.satfusion.filters.RejectAll;
import net.satfusion.query.Filter;
import net.satfusion.query.Model;
import net.satfusion.query.OutputConsumer;
import net.satfusion.query.PipelineNode;
import net.satfusion.query.PipelineNodeVisitor;
import net.satfusion.query.TimeSeries;

/**
 * Collects the time series, models and filters of a request and resolves 
 * the variable dependencies between them. 
 * <p>
 * Sources and models are accepted only when their required variables are
 * already available, so they must be added in dependency order: the master
 * first, then the slaves, then the models. The first producer of a variable
 * wins. Sources and models whose requirements are not met are silently 
 * dropped while unresolved filters are kept aside and turn {@link #filters()}
 * into a {@link RejectAll}.
 * <p>
 * After adding the output variables, {@link #reduce()} removes every producer
 * whose variables nobody consumes.
 * 
 * @since 1.0
 */
public class VariableResolver {
  private static final Logger LOG = LoggerFactory.getLogger(
      VariableResolver.class);

  /** The dependency graph. */
  protected final ProducerGraph graph;
  
  /** The master time series. */
  protected TimeSeries master;
  
  /** Accepted slave time series in insertion order. */
  protected final List<TimeSeries> slaves;
  
  /** Accepted models in insertion order. */
  protected final List<Model> models;
  
  /** Filters with all required variables available. */
  protected final List<Filter> resolved_filters;
  
  /** Filters with at least one unresolved variable. */
  protected final List<Filter> unresolved_filters;
  
  /** Output variables in request order, mandatory ones first. */
  protected final List<String> output_variables;
  
  /** The current output consumer node. */
  protected OutputConsumer output;
  
  /** Default ctor. */
  public VariableResolver() {
    graph = new ProducerGraph();
    slaves = Lists.newArrayList();
    models = Lists.newArrayList();
    resolved_filters = Lists.newArrayList();
    unresolved_filters = Lists.newArrayList();
    output_variables = Lists.newArrayList();
  }
  
  /**
   * Sets the master time series. Its variables become available at once.
   * @param master A non-null time series without required variables.
   * @throws IllegalStateException if a master was already set.
   */
  public void addMaster(final TimeSeries master) {
    if (master == null) {
      throw new IllegalArgumentException("Master cannot be null.");
    }
    if (this.master != null) {
      throw new IllegalStateException("Master is already set!");
    }
    this.master = master;
    graph.addProducer(master);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Added master {} providing {}", master.id(), 
          master.variables());
    }
  }
  
  /**
   * Adds a slave time series if its required variables, normally the time
   * variable, are available. Otherwise it is dropped.
   * @param slave A non-null time series.
   * @return True if the slave was accepted.
   */
  public boolean addSlave(final TimeSeries slave) {
    if (slave == null) {
      throw new IllegalArgumentException("Slave cannot be null.");
    }
    if (!graph.isResolved(slave.requiredVariables())) {
      LOG.debug("Dropping slave {} with unresolved requirements {}", 
          slave.id(), slave.requiredVariables());
      return false;
    }
    graph.addConsumer(slave);
    graph.addProducer(slave);
    slaves.add(slave);
    return true;
  }
  
  /**
   * Adds a model if its required variables are available from any producer
   * added so far. Otherwise it is dropped.
   * @param model A non-null model.
   * @return True if the model was accepted.
   */
  public boolean addModel(final Model model) {
    if (model == null) {
      throw new IllegalArgumentException("Model cannot be null.");
    }
    if (!graph.isResolved(model.requiredVariables())) {
      LOG.debug("Dropping model {} with unresolved requirements {}", 
          model.id(), model.requiredVariables());
      return false;
    }
    graph.addConsumer(model);
    graph.addProducer(model);
    models.add(model);
    return true;
  }
  
  /**
   * Adds a filter. A filter with unresolved variables is kept in the
   * unresolved list.
   * @param filter A non-null filter.
   * @return True if the filter was resolved.
   */
  public boolean addFilter(final Filter filter) {
    if (filter == null) {
      throw new IllegalArgumentException("Filter cannot be null.");
    }
    if (graph.addConsumer(filter)) {
      resolved_filters.add(filter);
      return true;
    }
    LOG.debug("Unresolved filter {} requiring {}", filter.id(), 
        filter.requiredVariables());
    unresolved_filters.add(filter);
    return false;
  }
  
  /**
   * Adds the filters in order.
   * @param filters A non-null collection of filters.
   */
  public void addFilters(final Collection<? extends Filter> filters) {
    for (final Filter filter : filters) {
      addFilter(filter);
    }
  }
  
  /**
   * Adds a consumer of any kind: time series are added as slaves, models as
   * models, filters as filters and an output consumer appends its variables
   * to the output.
   * @param node A non-null node.
   * @return True if the node was resolved and added.
   */
  public boolean addConsumer(final PipelineNode node) {
    if (node == null) {
      throw new IllegalArgumentException("Node cannot be null.");
    }
    return node.accept(adder);
  }
  
  /** Dispatches {@link #addConsumer(PipelineNode)}. */
  private final PipelineNodeVisitor<Boolean> adder = 
      new PipelineNodeVisitor<Boolean>() {
    @Override
    public Boolean visit(final TimeSeries time_series) {
      return addSlave(time_series);
    }
    
    @Override
    public Boolean visit(final Model model) {
      return addModel(model);
    }
    
    @Override
    public Boolean visit(final Filter filter) {
      return addFilter(filter);
    }
    
    @Override
    public Boolean visit(final OutputConsumer output) {
      addOutputVariables(output.requiredVariables());
      return true;
    }
  };
  
  /**
   * Adds all currently available variables to the output.
   */
  public void addOutputVariables() {
    addOutputVariables(graph.available());
  }
  
  /**
   * Adds the variables to the output. Variables that are not available are
   * ignored and duplicates are added once.
   * @param variables A non-null list of variables.
   */
  public void addOutputVariables(final List<String> variables) {
    if (variables == null) {
      throw new IllegalArgumentException("Variables cannot be null.");
    }
    for (final String variable : variables) {
      if (graph.isProduced(variable) 
          && !output_variables.contains(variable)) {
        output_variables.add(variable);
      }
    }
    if (output != null) {
      graph.removeConsumer(output);
    }
    output = new OutputConsumer(output_variables);
    graph.addConsumer(output);
  }
  
  /**
   * Removes the producers nobody needs. First the unresolved filters stop 
   * consuming, then the producers without consumers are removed until a 
   * fixed point is reached. Removing a model releases the variables it
   * consumed which may orphan further producers. The master is never 
   * removed.
   */
  public void reduce() {
    for (final Filter filter : unresolved_filters) {
      graph.removeConsumer(filter);
    }
    
    boolean changed = true;
    while (changed) {
      changed = false;
      for (final Model model : Lists.newArrayList(models)) {
        if (!graph.isConsumed(model)) {
          removeProducer(model);
          models.remove(model);
          changed = true;
        }
      }
      for (final TimeSeries slave : Lists.newArrayList(slaves)) {
        if (!graph.isConsumed(slave)) {
          removeProducer(slave);
          slaves.remove(slave);
          changed = true;
        }
      }
    }
  }
  
  private void removeProducer(final PipelineNode node) {
    final List<String> removed = graph.removeNode(node);
    output_variables.removeAll(removed);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Removed unused producer {} of {}", node.id(), removed);
    }
  }
  
  /** @return The master time series, may be null. */
  public TimeSeries master() {
    return master;
  }
  
  /** @return The accepted slaves in insertion order. */
  public List<TimeSeries> slaves() {
    return ImmutableList.copyOf(slaves);
  }
  
  /** @return The master followed by the slaves. */
  public List<TimeSeries> timeSeries() {
    final ImmutableList.Builder<TimeSeries> builder = ImmutableList.builder();
    if (master != null) {
      builder.add(master);
    }
    return builder.addAll(slaves).build();
  }
  
  /** @return The accepted models in evaluation order. */
  public List<Model> models() {
    return ImmutableList.copyOf(models);
  }
  
  /** @return The filters to apply, a single {@link RejectAll} if any filter
   * was unresolved. */
  public List<Filter> filters() {
    if (!unresolved_filters.isEmpty()) {
      return ImmutableList.<Filter>of(RejectAll.INSTANCE);
    }
    return ImmutableList.copyOf(resolved_filters);
  }
  
  /** @return The resolved filters. */
  public List<Filter> resolvedFilters() {
    return ImmutableList.copyOf(resolved_filters);
  }
  
  /** @return The unresolved filters. */
  public List<Filter> unresolvedFilters() {
    return ImmutableList.copyOf(unresolved_filters);
  }
  
  /** @return The output variables in order. */
  public List<String> outputVariables() {
    return ImmutableList.copyOf(output_variables);
  }
  
  /** @return The available variables in registration order. */
  public List<String> available() {
    return graph.available();
  }
  
  /**
   * @return The variables that have to be extracted or evaluated: the 
   * output variables followed by the variables required by the remaining
   * slaves, models and resolved filters.
   */
  public List<String> required() {
    final Set<String> required = Sets.newLinkedHashSet(output_variables);
    for (final TimeSeries slave : slaves) {
      required.addAll(slave.requiredVariables());
    }
    for (final Model model : models) {
      required.addAll(model.requiredVariables());
    }
    for (final Filter filter : resolved_filters) {
      required.addAll(filter.requiredVariables());
    }
    return ImmutableList.copyOf(required);
  }
  
  /**
   * @param node A node.
   * @return The variables the node is the registered producer of.
   */
  public List<String> producedBy(final PipelineNode node) {
    final List<String> variables = Lists.newArrayList();
    for (final String variable : graph.available()) {
      if (graph.producer(variable) == node) {
        variables.add(variable);
      }
    }
    return variables;
  }
  
  /** @return The dependency graph. */
  public ProducerGraph graph() {
    return graph;
  }
  
  /** @return The sorted identifiers of the products used by the time
   * series and models. */
  public List<String> productNames() {
    return productNames(ImmutableList.of(this));
  }
  
  /**
   * @param resolvers A non-null collection of resolvers.
   * @return The sorted union of the products used by the resolvers.
   */
  public static List<String> productNames(
      final Collection<VariableResolver> resolvers) {
    final TreeSet<String> products = new TreeSet<String>();
    for (final VariableResolver resolver : resolvers) {
      for (final Model model : resolver.models) {
        products.addAll(model.products());
      }
      for (final TimeSeries time_series : resolver.timeSeries()) {
        products.addAll(time_series.products());
      }
    }
    return ImmutableList.copyOf(products);
  }
}
