// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.utils.timing;

import com.android.tools.resourceremap.utils.SystemPropertyUtils;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

public class TimingImpl extends Timing {

  private static final int MINIMUM_REPORT_MS =
      SystemPropertyUtils.parseSystemPropertyOrDefault(
          "com.android.tools.resourceremap.printtimes.minvalue_ms", 0);

  private final Node top;
  private final Deque<Node> stack;

  TimingImpl(String title) {
    stack = new ArrayDeque<>();
    top = new Node(title);
    stack.push(top);
  }

  static class Node {
    final String title;

    final Map<String, Node> children = new LinkedHashMap<>();
    long duration = 0;
    long startTime;

    Node(String title) {
      this.title = title;
      this.startTime = System.nanoTime();
    }

    void restart() {
      assert startTime == -1;
      startTime = System.nanoTime();
    }

    void end() {
      duration += System.nanoTime() - startTime;
      startTime = -1;
      assert duration >= 0;
    }

    @Override
    public String toString() {
      return title + ": " + prettyTime(duration);
    }

    void report(int depth, Node top) {
      if (duration / 1_000_000 < MINIMUM_REPORT_MS) {
        return;
      }
      if (depth > 0) {
        System.out.print("  ".repeat(depth));
        System.out.print("- ");
        System.out.print("(" + prettyPercentage(duration, top.duration) + ") ");
      }
      System.out.println(this);
      children.values().forEach(child -> child.report(depth + 1, top));
    }
  }

  @Override
  public Timing begin(String title) {
    Node parent = stack.peek();
    Node child = parent.children.get(title);
    if (child != null) {
      child.restart();
    } else {
      child = new Node(title);
      parent.children.put(title, child);
    }
    stack.push(child);
    return this;
  }

  @Override
  public Timing end() {
    stack.peek().end();
    stack.pop();
    return this;
  }

  @Override
  public void report() {
    assert stack.isEmpty() : "Timing report requested before all timers ended";
    top.report(0, top);
  }

  static String prettyTime(long nanoTime) {
    return (nanoTime / 1_000_000) + "ms";
  }

  static String prettyPercentage(long part, long total) {
    if (total == 0) {
      return "100%";
    }
    return (part * 100 / total) + "%";
  }
}
