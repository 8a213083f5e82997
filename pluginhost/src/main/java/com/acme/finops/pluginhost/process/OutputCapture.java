package com.acme.finops.pluginhost.process;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Keeps the most recent lines a child wrote to one of its streams.
 */
public final class OutputCapture {
    private final int maxLines;
    private final Deque<String> lines = new ArrayDeque<>();
    private long dropped;

    public OutputCapture(int maxLines) {
        this.maxLines = Math.max(1, maxLines);
    }

    public synchronized void append(String line) {
        if (lines.size() == maxLines) {
            lines.removeFirst();
            dropped++;
        }
        lines.addLast(line);
    }

    public synchronized String snapshot() {
        StringBuilder sb = new StringBuilder();
        if (dropped > 0) {
            sb.append("... ").append(dropped).append(" earlier lines dropped\n");
        }
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    public synchronized boolean isEmpty() {
        return lines.isEmpty();
    }
}
