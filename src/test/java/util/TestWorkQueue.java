package util;

import java.util.ArrayList;
import java.util.Arrays;

import junit.framework.TestCase;

public class TestWorkQueue extends TestCase {

    public void testFirstInFirstOut() {
        WorkQueue<String> q = new WorkQueue<>(Arrays.asList("a", "b"));
        q.add("c");
        assertEquals("a", q.poll());
        assertEquals("b", q.poll());
        assertEquals("c", q.poll());
        assertTrue(q.isEmpty());
        assertNull(q.poll());
    }

    public void testElementsProcessedOnce() {
        WorkQueue<String> q = new WorkQueue<>();
        assertTrue(q.add("a"));
        assertFalse(q.add("a"));
        assertEquals("a", q.poll());
        // already processed
        assertFalse(q.add("a"));
        assertTrue(q.isEmpty());
        assertTrue(q.addAll(Arrays.asList("a", "b")));
        assertEquals("b", q.poll());
        assertEquals(Arrays.asList("a", "b"), new ArrayList<>(q.getAllAdded()));
    }
}
