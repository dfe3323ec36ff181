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
package net.satfusion.query;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.satfusion.configuration.Configuration;
import net.satfusion.data.Column;
import net.satfusion.data.Dataset;
import net.satfusion.data.DatasetIterator;
import net.satfusion.exceptions.QueryExecutionException;
import net.satfusion.query.resolver.VariableResolver;
import net.satfusion.timeseries.ChunkIterator;
import net.satfusion.utils.DateTime;
import net.satfusion.utils.Pair;

/**
 * Evaluates a reduced {@link VariableResolver} over a time window. Each 
 * chunk of the master is filtered, merged with the slaves interpolated at
 * its times and extended by the models. The filters are applied as soon as
 * their variables are available. The output holds the output variables of
 * the resolver.
 * <p>
 * The pipeline is pull based, nothing is read before the first call to 
 * {@link DatasetIterator#hasNext()}.
 * 
 * @since 1.0
 */
public class DataPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(
      DataPipeline.class);
  
  /** The configuration key of the maximum number of output samples. */
  public static final String MAX_SAMPLES_KEY = "satfusion.query.max_samples";
  
  /** The default maximum number of output samples. */
  public static final long DEFAULT_MAX_SAMPLES = 432000;
  
  /** The status code when the sample limit is exceeded. */
  public static final int TOO_LARGE = 413;
  
  /** The resolver. */
  private final VariableResolver resolver;
  
  /** The time variable of the master. */
  private final String time_variable;
  
  /** The maximum number of samples. */
  private final long max_samples;
  
  /**
   * Default ctor.
   * @param resolver A non-null, reduced resolver with a master.
   * @param time_variable The non-null time variable of the master.
   * @param max_samples The maximum number of output samples.
   */
  public DataPipeline(final VariableResolver resolver, 
                      final String time_variable, 
                      final long max_samples) {
    if (resolver == null) {
      throw new IllegalArgumentException("Resolver cannot be null.");
    }
    if (resolver.master() == null) {
      throw new IllegalArgumentException("Resolver has no master.");
    }
    if (time_variable == null || time_variable.isEmpty()) {
      throw new IllegalArgumentException("Time variable cannot be null or "
          + "empty.");
    }
    if (max_samples < 1) {
      throw new IllegalArgumentException("Max samples must be positive.");
    }
    this.resolver = resolver;
    this.time_variable = time_variable;
    this.max_samples = max_samples;
  }
  
  /**
   * Ctor with the sample limit read from the configuration.
   * @param resolver A non-null, reduced resolver with a master.
   * @param time_variable The non-null time variable of the master.
   * @param config A non-null configuration.
   */
  public DataPipeline(final VariableResolver resolver, 
                      final String time_variable, 
                      final Configuration config) {
    this(resolver, time_variable, registerConfigs(config)
        .getLong(MAX_SAMPLES_KEY));
  }
  
  /**
   * Registers the pipeline keys if not already registered.
   * @param config A non-null configuration.
   * @return The configuration.
   */
  public static Configuration registerConfigs(final Configuration config) {
    if (config == null) {
      throw new IllegalArgumentException("Configuration cannot be null.");
    }
    if (!config.hasProperty(MAX_SAMPLES_KEY)) {
      config.register(MAX_SAMPLES_KEY, DEFAULT_MAX_SAMPLES, 
          "The maximum number of samples a single query may return.");
    }
    return config;
  }
  
  /** @return The resolver. */
  public VariableResolver resolver() {
    return resolver;
  }
  
  /**
   * Lazily evaluates the pipeline.
   * @param start The inclusive start in milliseconds.
   * @param end The exclusive end in milliseconds.
   * @return The output chunks, one per master chunk.
   * @throws QueryExecutionException while iterating if a filter could not 
   * be applied, a product could not be read or the sample limit was 
   * exceeded.
   */
  public DatasetIterator execute(final long start, final long end) {
    if (end < start) {
      throw new IllegalArgumentException("End cannot be before the start.");
    }
    final List<String> all_variables = resolver.required();
    final List<String> variables = Lists.newArrayList(all_variables);
    variables.removeAll(resolver.master().variables());
    if (LOG.isDebugEnabled()) {
      LOG.debug("Executing {}/{} master: {} slaves: {} models: {} "
          + "filters: {} output: {}", DateTime.format(start), 
          DateTime.format(end), resolver.master().id(), 
          resolver.slaves().size(), resolver.models().size(), 
          resolver.filters().size(), resolver.outputVariables());
    }
    return new Chunks(resolver.master().subset(start, end, all_variables), 
        ImmutableList.copyOf(variables));
  }
  
  /** Pulls one master chunk per output chunk. */
  private class Chunks extends ChunkIterator {
    private final DatasetIterator master;
    private final List<String> variables;
    private long total_count;
    
    Chunks(final DatasetIterator master, final List<String> variables) {
      this.master = master;
      this.variables = variables;
    }
    
    @Override
    protected Dataset computeNext() {
      if (!master.hasNext()) {
        LOG.debug("Pipeline done, total count: {}", total_count);
        return endOfData();
      }
      Dataset dataset = master.next();
      LOG.debug("Dataset length before applying filters: {}", 
          dataset.length());
      
      Pair<Dataset, List<Filter>> filtered = dataset.filter(
          resolver.filters(), null);
      dataset = filtered.getKey();
      List<Filter> filters_left = filtered.getValue();
      
      for (final TimeSeries slave : resolver.slaves()) {
        // filters may have dropped rows since the previous slave
        final Column times = dataset.get(time_variable);
        if (times == null) {
          throw new QueryExecutionException("Master chunk lacks the time "
              + "variable " + time_variable, 500);
        }
        dataset.merge(slave.interpolate(times.longs(), variables, null));
        filtered = dataset.filter(filters_left, null);
        dataset = filtered.getKey();
        filters_left = filtered.getValue();
      }
      
      for (final Model model : resolver.models()) {
        dataset.merge(model.eval(dataset, variables));
        filtered = dataset.filter(filters_left, null);
        dataset = filtered.getKey();
        filters_left = filtered.getValue();
      }
      LOG.debug("Dataset length after applying filters: {}", 
          dataset.length());
      
      if (!filters_left.isEmpty()) {
        throw new QueryExecutionException("Failed to apply some of the "
            + "filters due to missing source variables! filters: " 
            + Joiner.on("; ").join(filters_left), 400);
      }
      
      total_count += dataset.length();
      if (total_count > max_samples) {
        LOG.warn("The sample count {} exceeds the maximum allowed count of "
            + "{} samples!", total_count, max_samples);
        throw new QueryExecutionException("Requested data exceeds the "
            + "maximum limit of " + max_samples + " records!", TOO_LARGE);
      }
      return dataset.extract(resolver.outputVariables());
    }
    
    @Override
    public void close() {
      master.close();
    }
  }
}
