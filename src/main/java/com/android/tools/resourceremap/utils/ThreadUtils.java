// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;

public class ThreadUtils {

  public enum WorkLoad {
    // The threshold for HEAVY is basically just a fan-out when we have two items to process.
    HEAVY(2),
    // R class initializers are small, so only fan out when there is a handful of them.
    LIGHT(4);

    private final int threshold;

    WorkLoad(int threshold) {
      this.threshold = threshold;
    }

    public int getThreshold() {
      return threshold;
    }
  }

  public static final int NOT_SPECIFIED = -1;

  /**
   * Applies {@code function} to every item and returns the results in the iteration order of
   * {@code items}, independently of the order in which the tasks complete.
   */
  public static <T, R, E extends Exception> List<R> processItemsWithResults(
      Collection<T> items,
      ThrowingFunction<T, R, E> function,
      ExecutorService executorService,
      WorkLoad workLoad)
      throws ExecutionException {
    if (items.size() < workLoad.getThreshold()) {
      List<R> results = new ArrayList<>(items.size());
      for (T item : items) {
        try {
          results.add(function.apply(item));
        } catch (Exception e) {
          throw new ExecutionException(e);
        }
      }
      return results;
    }
    List<Future<R>> futures = new ArrayList<>(items.size());
    for (T item : items) {
      futures.add(executorService.submit(() -> function.apply(item)));
    }
    return awaitFuturesWithResults(futures);
  }

  public static <T> List<T> awaitFuturesWithResults(Collection<? extends Future<T>> futures)
      throws ExecutionException {
    List<T> results = new ArrayList<>(futures.size());
    Iterator<? extends Future<T>> futureIterator = futures.iterator();
    try {
      while (futureIterator.hasNext()) {
        results.add(futureIterator.next().get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException("Interrupted while waiting for future.", e);
    } finally {
      // In case we get interrupted or one of the threads throws an exception, abort all further
      // work, if possible.
      while (futureIterator.hasNext()) {
        futureIterator.next().cancel(true);
      }
    }
    return results;
  }

  public static ExecutorService getExecutorService(int threads) {
    if (threads == 1) {
      return Executors.newSingleThreadExecutor();
    }
    return new ForkJoinPool(getNumberOfThreads(threads));
  }

  public static int getNumberOfThreads(ExecutorService service) {
    if (service instanceof ForkJoinPool) {
      return ((ForkJoinPool) service).getParallelism();
    }
    if (service instanceof ThreadPoolExecutor) {
      return ((ThreadPoolExecutor) service).getMaximumPoolSize();
    }
    return -1;
  }

  public static int getNumberOfThreads(int threads) {
    return threads == NOT_SPECIFIED ? Runtime.getRuntime().availableProcessors() : threads;
  }
}
