// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.position;

/** Base interface for positions in an origin. */
public interface Position {

  /** Position which is unknown. */
  Position UNKNOWN =
      new Position() {
        @Override
        public String toString() {
          return "UNKNOWN";
        }

        @Override
        public String getDescription() {
          return "Unknown";
        }
      };

  String getDescription();
}
