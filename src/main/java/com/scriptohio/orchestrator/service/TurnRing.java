package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.model.ConversationTurn;

import java.util.ArrayList;
import java.util.List;

// not thread-safe; guarded by the owning user's lock
public class TurnRing {

    private final ConversationTurn[] slots;
    private int head;
    private int size;

    public TurnRing(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Ring capacity must be positive: " + capacity);
        }
        this.slots = new ConversationTurn[capacity];
    }

    // returns the evicted turn, or null
    public ConversationTurn add(ConversationTurn turn) {
        int tail = (head + size) % slots.length;
        ConversationTurn evicted = null;
        if (size == slots.length) {
            evicted = slots[head];
            head = (head + 1) % slots.length;
        } else {
            size++;
        }
        slots[tail] = turn;
        return evicted;
    }

    // oldest first
    public List<ConversationTurn> latest(int n) {
        int count = Math.max(0, Math.min(n, size));
        List<ConversationTurn> turns = new ArrayList<>(count);
        for (int i = size - count; i < size; i++) {
            turns.add(slots[(head + i) % slots.length]);
        }
        return turns;
    }

    public List<ConversationTurn> all() {
        return latest(size);
    }

    public ConversationTurn last() {
        return size == 0 ? null : slots[(head + size - 1) % slots.length];
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }
}
