// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.app;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.stackless.compiler.TransformException;
import org.stackless.parser.CoroutineParser;

public class AppTest {
  private static final String SOURCE =
      """
      def f = coroutine (x: Int) => {
        val y = x + 1
        yieldval(y)
        val z = y * 2
        yieldval(z)
        z + 1
      }
      """;

  @Test
  public void runPrintsYieldsAndReturnValue() {
    assertEquals(
        List.of("yield: 4", "yield: 8", "return: 9"),
        run(SOURCE, "run", "f", "3").lines().toList());
  }

  @Test
  public void readAstAcceptsParserOutput() {
    String jsonAst = CoroutineParser.parse("<test>", SOURCE).toString();
    assertEquals(
        List.of("yield: 1", "yield: 2", "return: 3"),
        run(jsonAst, "read-ast", "run", "f", "0").lines().toList());
  }

  @Test
  public void dumpSubgraphsPrintsJson() {
    var subgraphs = JsonParser.parseString(run(SOURCE, "dump-subgraphs")).getAsJsonArray();
    assertEquals(3, subgraphs.size());
    var first = subgraphs.get(0).getAsJsonObject();
    assertEquals("f", first.get("coroutine").getAsString());
    assertEquals(0, first.get("id").getAsInt());
  }

  @Test
  public void dumpCodeAndGraph() {
    String output = run(SOURCE, "dump-cfg", "dump-code");
    assertTrue(output.startsWith("f:"), output);
    assertTrue(output.contains("def ep2(c: Coroutine): Unit = {"), output);
    assertTrue(output.contains("case 2 => ep2(c)"), output);
  }

  @Test
  public void runChecksArgumentCount() {
    var e = assertThrows(IllegalArgumentException.class, () -> run(SOURCE, "run", "f"));
    assertEquals("Coroutine f takes 1 argument(s) but 0 given", e.getMessage());
  }

  @Test
  public void transformErrorsPropagate() {
    var e =
        assertThrows(
            TransformException.class, () -> run("def f = coroutine () => yieldval(y)", "run", "f"));
    assertEquals("line 1: Name 'y' is not defined", e.describe());
  }

  private static String run(String stdin, String... args) {
    var bytes = new ByteArrayOutputStream();
    var out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    App.run(List.of(args), stdin, out);
    return bytes.toString(StandardCharsets.UTF_8);
  }
}
