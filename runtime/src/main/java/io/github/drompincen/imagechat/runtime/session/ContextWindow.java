package io.github.drompincen.imagechat.runtime.session;

import io.github.drompincen.imagechat.runtime.generation.ContextTurn;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** Bounded rolling window of recent turns; the oldest turn is dropped first. */
public class ContextWindow {

    private final int capacity;
    private final Deque<ContextTurn> turns = new ArrayDeque<>();

    public ContextWindow(int capacity) {
        this.capacity = Math.max(0, capacity);
    }

    public synchronized void add(ContextTurn turn) {
        if (capacity == 0) return;
        if (turns.size() == capacity) {
            turns.removeFirst();
        }
        turns.addLast(turn);
    }

    public synchronized List<ContextTurn> snapshot() {
        return List.copyOf(turns);
    }

    public synchronized int size() { return turns.size(); }

    public int capacity() { return capacity; }
}
