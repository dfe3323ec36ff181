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
package net.satfusion.maintenance;

import java.io.Closeable;
import java.util.Iterator;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.AbstractIterator;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import net.satfusion.configuration.Configuration;

/**
 * Fans independent units of work out to a fixed-size worker pool while 
 * keeping at most {@link #MAX_JOB_COUNT_FACTOR} times the number of workers
 * in flight. Inputs are pulled lazily and the results are returned in 
 * completion order through a single iterator on the calling thread.
 * 
 * @since 1.0
 */
public class StreamExecutor implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(
      StreamExecutor.class);
  
  /** The configuration key of the number of workers. */
  public static final String WORKERS_KEY = "satfusion.maintenance.workers";
  
  /** Maximum number of submitted units per worker. */
  public static final int MAX_JOB_COUNT_FACTOR = 2;
  
  /** The number of workers. */
  private final int workers;
  
  /** The pool. */
  private final ExecutorService pool;
  
  /**
   * Default ctor.
   * @param workers The number of workers, at least 1.
   */
  public StreamExecutor(final int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("Workers must be at least 1.");
    }
    this.workers = workers;
    pool = Executors.newFixedThreadPool(workers, new ThreadFactoryBuilder()
        .setNameFormat("satfusion-maintenance-%d")
        .setDaemon(true)
        .build());
    LOG.info("Initialized new StreamExecutor with {} workers", workers);
  }
  
  /**
   * Builds an executor sized from the configuration, registering the key 
   * if needed. Defaults to the number of processors.
   * @param config A non-null configuration.
   * @return The executor.
   */
  public static StreamExecutor fromConfiguration(final Configuration config) {
    if (!config.hasProperty(WORKERS_KEY)) {
      config.register(WORKERS_KEY, 
          Runtime.getRuntime().availableProcessors(), 
          "The number of workers of the maintenance jobs.");
    }
    return new StreamExecutor(config.getInt(WORKERS_KEY));
  }
  
  /** @return The number of workers. */
  public int workers() {
    return workers;
  }
  
  /** @return The maximum number of units in flight. */
  public int maxInFlight() {
    return workers * MAX_JOB_COUNT_FACTOR;
  }
  
  /**
   * Runs the task for every input.
   * @param inputs The non-null inputs, pulled as units complete.
   * @param task The non-null task.
   * @return An iterator over the results in completion order.
   */
  public <I, O> Iterator<TaskResult<I, O>> execute(
      final Iterator<? extends I> inputs, 
      final Task<I, O> task) {
    if (inputs == null) {
      throw new IllegalArgumentException("Inputs cannot be null.");
    }
    if (task == null) {
      throw new IllegalArgumentException("Task cannot be null.");
    }
    final CompletionService<TaskResult<I, O>> service = 
        new ExecutorCompletionService<TaskResult<I, O>>(pool);
    return new AbstractIterator<TaskResult<I, O>>() {
      private int in_flight;
      
      @Override
      protected TaskResult<I, O> computeNext() {
        while (in_flight < maxInFlight() && inputs.hasNext()) {
          final I input = inputs.next();
          service.submit(new Callable<TaskResult<I, O>>() {
            @Override
            public TaskResult<I, O> call() {
              try {
                return TaskResult.success(input, task.run(input));
              } catch (Exception e) {
                return TaskResult.failure(input, e);
              }
            }
          });
          in_flight++;
        }
        if (in_flight < 1) {
          return endOfData();
        }
        try {
          final TaskResult<I, O> result = service.take().get();
          in_flight--;
          return result;
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while waiting for "
              + "the workers.", e);
        } catch (ExecutionException e) {
          // the callable catches everything but errors
          throw new IllegalStateException("Worker failed.", e.getCause());
        }
      }
    };
  }
  
  /**
   * Shuts the pool down, waiting a few seconds for running units.
   */
  @Override
  public void close() {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        LOG.warn("Workers did not terminate in time, interrupting.");
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pool.shutdownNow();
    }
    LOG.info("Shut down StreamExecutor");
  }
}
