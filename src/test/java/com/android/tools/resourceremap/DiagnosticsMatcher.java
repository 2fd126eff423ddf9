// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap;

import com.android.tools.resourceremap.origin.Origin;
import com.android.tools.resourceremap.position.MethodPosition;
import com.android.tools.resourceremap.position.Position;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

public abstract class DiagnosticsMatcher extends TypeSafeMatcher<Diagnostic> {

  public static Matcher<Diagnostic> diagnosticType(Class<? extends Diagnostic> type) {
    return new DiagnosticsMatcher() {
      @Override
      protected boolean eval(Diagnostic diagnostic) {
        return type.isInstance(diagnostic);
      }

      @Override
      protected void explain(Description description) {
        description.appendText("type ").appendText(type.getName());
      }
    };
  }

  public static Matcher<Diagnostic> diagnosticMessage(Matcher<String> messageMatcher) {
    return new DiagnosticsMatcher() {
      @Override
      protected boolean eval(Diagnostic diagnostic) {
        return messageMatcher.matches(diagnostic.getDiagnosticMessage());
      }

      @Override
      protected void explain(Description description) {
        description.appendText("message ").appendDescriptionOf(messageMatcher);
      }
    };
  }

  public static Matcher<Diagnostic> diagnosticOrigin(Origin origin) {
    return new DiagnosticsMatcher() {
      @Override
      protected boolean eval(Diagnostic diagnostic) {
        return diagnostic.getOrigin().equals(origin);
      }

      @Override
      protected void explain(Description description) {
        description.appendText("origin ").appendText(origin.toString());
      }
    };
  }

  public static Matcher<Diagnostic> diagnosticInstructionIndex(int instructionIndex) {
    return new DiagnosticsMatcher() {
      @Override
      protected boolean eval(Diagnostic diagnostic) {
        Position position = diagnostic.getPosition();
        return position instanceof MethodPosition
            && ((MethodPosition) position).getInstructionIndex() == instructionIndex;
      }

      @Override
      protected void explain(Description description) {
        description.appendText("instruction index ").appendValue(instructionIndex);
      }
    };
  }

  @Override
  protected boolean matchesSafely(Diagnostic diagnostic) {
    return eval(diagnostic);
  }

  @Override
  public void describeTo(Description description) {
    explain(description.appendText("a diagnostic with "));
  }

  protected abstract boolean eval(Diagnostic diagnostic);

  protected abstract void explain(Description description);
}
