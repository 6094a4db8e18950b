package com.telemetry.activity.export;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity FIFO shared by many producers and the single export thread.
 * {@link #offer} never blocks: when full it refuses the new item.
 */
final class BoundedBuffer<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<T> items = new ArrayDeque<>();
    private final int capacity;

    BoundedBuffer(int capacity) {
        this.capacity = capacity;
    }

    boolean offer(T item) {
        lock.lock();
        try {
            if (items.size() >= capacity) {
                return false;
            }
            items.addLast(item);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns up to {@code max} items in arrival order.
     */
    List<T> drain(int max) {
        lock.lock();
        try {
            int count = Math.min(max, items.size());
            List<T> batch = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                batch.add(items.pollFirst());
            }
            return batch;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes back an item this buffer still holds.
     *
     * @return false if the item has already been drained or cleared
     */
    boolean remove(T item) {
        lock.lock();
        try {
            return items.removeLastOccurrence(item);
        } finally {
            lock.unlock();
        }
    }

    int clear() {
        lock.lock();
        try {
            int size = items.size();
            items.clear();
            return size;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }
}
