package util;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Work queue for closure computations. An element is only ever processed once: adding an element that has already
 * been added (whether or not it has been removed since) does nothing. The set of everything ever added is the result
 * of the closure once the queue is empty.
 *
 * @param <T>
 *            type of queue elements, must have hashCode and equals defined
 */
public class WorkQueue<T> {

    /**
     * Elements waiting to be processed
     */
    private final Deque<T> q = new ArrayDeque<>();
    /**
     * Every element ever added, in the order it was added
     */
    private final Set<T> added = new LinkedHashSet<>();

    /**
     * Create an empty queue
     */
    public WorkQueue() {
    }

    /**
     * Create a queue containing all the elements in the given collection
     *
     * @param c
     *            initial elements of the queue
     */
    public WorkQueue(Collection<? extends T> c) {
        this.addAll(c);
    }

    /**
     * Add n to the back of the queue if it has never been added before
     *
     * @param n
     *            element to add
     * @return true if the element is new
     */
    public boolean add(T n) {
        boolean isNew = added.add(n);
        if (isNew) {
            q.addLast(n);
        }
        return isNew;
    }

    /**
     * Add a collection of elements to the back of the queue.
     *
     * @param collection
     *            elements to add
     * @return true if any of the elements was new
     */
    public boolean addAll(Collection<? extends T> collection) {
        boolean changed = false;
        for (T n : collection) {
            changed |= add(n);
        }
        return changed;
    }

    /**
     * Get and remove the next element from the queue
     *
     * @return the next element or null if the queue is empty
     */
    public T poll() {
        return q.pollFirst();
    }

    public boolean isEmpty() {
        return q.isEmpty();
    }

    /**
     * Everything added to the queue so far
     *
     * @return new modifiable set containing every element ever added, in insertion order
     */
    public Set<T> getAllAdded() {
        return new LinkedHashSet<>(added);
    }

    @Override
    public String toString() {
        return q.toString();
    }
}
