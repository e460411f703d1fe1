package org.allenai.academicreader;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

@Test
public class MathFormulaIsolatorTest {
  private final MathFormulaIsolator isolator = new MathFormulaIsolator();

  public void testInlineFormula() {
    final List<String> formulas = new ArrayList<>();
    final String out = isolator.isolate("Energy $E=mc^2$ is conserved", formulas);
    Assert.assertEquals(out, "Energy [MATH_FORMULA_1] is conserved");
    Assert.assertEquals(formulas, Collections.singletonList("$E=mc^2$"));
  }

  public void testNumberingContinuesAcrossCalls() {
    final List<String> formulas = new ArrayList<>();
    isolator.isolate("first $a$", formulas);
    final String out = isolator.isolate("second $b$ and $c$", formulas);
    Assert.assertEquals(out, "second [MATH_FORMULA_2] and [MATH_FORMULA_3]");
    Assert.assertEquals(formulas, Arrays.asList("$a$", "$b$", "$c$"));
  }

  public void testInlinePatternRunsBeforeDisplayPattern() {
    final List<String> formulas = new ArrayList<>();
    final String out = isolator.isolate("$$x$$", formulas);
    Assert.assertEquals(out, "$[MATH_FORMULA_1]$");
    Assert.assertEquals(formulas, Collections.singletonList("$x$"));
  }

  public void testSymbolsInsideInlineFormulaAreNotCapturedTwice() {
    final List<String> formulas = new ArrayList<>();
    final String out = isolator.isolate("where $α+1$ holds", formulas);
    Assert.assertEquals(out, "where [MATH_FORMULA_1] holds");
    Assert.assertEquals(formulas.size(), 1);
  }

  public void testStandaloneSymbols() {
    final List<String> formulas = new ArrayList<>();
    final String out = isolator.isolate("α ≤ β", formulas);
    Assert.assertEquals(out, "[MATH_FORMULA_1] [MATH_FORMULA_2] [MATH_FORMULA_3]");
    Assert.assertEquals(formulas, Arrays.asList("α", "≤", "β"));
  }

  public void testEquationEnvironmentSpansLines() {
    final List<String> formulas = new ArrayList<>();
    final String out = isolator.isolate("before \\begin{equation}\na+b\n\\end{equation} after", formulas);
    Assert.assertEquals(out, "before [MATH_FORMULA_1] after");
    Assert.assertEquals(formulas, Collections.singletonList("\\begin{equation}\na+b\n\\end{equation}"));
  }

  public void testCustomPatternTable() {
    final MathFormulaIsolator custom = new MathFormulaIsolator(Collections.singletonList(Pattern.compile("x\\^\\d")));
    final List<String> formulas = new ArrayList<>();
    Assert.assertEquals(custom.isolate("x^2 + $y$", formulas), "[MATH_FORMULA_1] + $y$");
  }

  public void testTextWithoutFormulas() {
    final List<String> formulas = new ArrayList<>();
    Assert.assertEquals(isolator.isolate("plain prose", formulas), "plain prose");
    Assert.assertTrue(formulas.isEmpty());
  }
}
