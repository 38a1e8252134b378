// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.runtime;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class StackTest {

  @Test
  public void longStackPositionsCountFromTop() {
    var stack = new LongStack("test");
    stack.push(10, 2);
    stack.push(20, 2);
    stack.push(30, 2); // Grows past the initial capacity.
    assertEquals(3, stack.size());
    assertEquals(30, stack.top());
    assertEquals(20, stack.get(1));
    assertEquals(10, stack.get(2));

    stack.set(2, 11);
    stack.update(31);
    assertEquals(31, stack.pop());
    assertEquals(20, stack.pop());
    assertEquals(11, stack.pop());
    assertTrue(stack.isEmpty());
  }

  @Test
  public void longStackRejectsOutOfRangeAccess() {
    var stack = new LongStack("test");
    assertThrows(IllegalStateException.class, stack::pop);
    stack.push(1, -1);
    var e = assertThrows(IllegalStateException.class, () -> stack.get(1));
    assertEquals("Position 1 out of range for region test of size 1", e.getMessage());
    assertThrows(IllegalStateException.class, () -> stack.set(-1, 0));
  }

  @Test
  public void refStackReleasesPoppedReferences() {
    var stack = new RefStack<String>("refs");
    for (int i = 0; i < 20; ++i) {
      stack.push("s" + i, -1);
    }
    assertEquals("s19", stack.top());
    assertEquals("s0", stack.get(19));
    stack.set(0, "top");
    assertEquals("top", stack.pop());
    assertEquals(19, stack.size());
    assertEquals("s18", stack.top());
  }

  @Test
  public void emptyRefStackCannotPop() {
    var stack = new RefStack<Object>("refs");
    var e = assertThrows(IllegalStateException.class, stack::pop);
    assertEquals("Cannot pop empty region: refs", e.getMessage());
    assertEquals("refs[]", stack.toString());
  }
}
