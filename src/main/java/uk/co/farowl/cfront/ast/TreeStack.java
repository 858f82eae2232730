package uk.co.farowl.cfront.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A last-in, first-out stack used while building a tree bottom-up. Unlike the JDK collections,
 * popping or peeking beyond the bottom is a checked {@link ConstructionError}.
 *
 * @param <T> type of entry
 */
public class TreeStack<T> {

    private final List<T> entries = new ArrayList<>();

    /** Push an entry. */
    public void push(T entry) {
        entries.add(entry);
    }

    /**
     * Remove and return the top entry.
     *
     * @return the entry removed
     * @throws ConstructionError if the stack is empty
     */
    public T pop() throws ConstructionError {
        if (entries.isEmpty()) {
            throw new ConstructionError(ConstructionError.Kind.UNDERFLOW, "pop of empty stack");
        }
        return entries.remove(entries.size() - 1);
    }

    /**
     * Return an entry without removing it.
     *
     * @param k position counting from the top (0 is the top)
     * @return the entry
     * @throws ConstructionError if the stack holds fewer than {@code k+1} entries
     */
    public T peek(int k) throws ConstructionError {
        int i = entries.size() - 1 - k;
        if (k < 0 || i < 0) {
            throw new ConstructionError(ConstructionError.Kind.UNDERFLOW,
                    String.format("peek(%d) on stack of %d", k, entries.size()));
        }
        return entries.get(i);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
