package com.naturalsql.service;

import com.naturalsql.compiler.PromptBuilder;
import com.naturalsql.model.HistoryEntry;
import com.naturalsql.model.HistoryStats;
import com.naturalsql.model.SimilarRequest;

import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, append-only record of one session's request outcomes. The oldest entries are dropped first.
 */
public class HistoryStore {

    private static final int MAX_ERROR_LENGTH = 512;
    static final double SIMILARITY_THRESHOLD = 0.3;

    private final boolean enabled;
    private final int maxEntries;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong();

    public HistoryStore(boolean enabled, int maxEntries) {
        this.enabled = enabled;
        this.maxEntries = Math.max(1, maxEntries);
    }

    /**
     * Record an outcome. The sequence number, timestamp and sanitized error message are assigned here.
     *
     * @param draft entry without sequence or timestamp
     * @return the stored entry
     */
    public HistoryEntry append(HistoryEntry draft) {
        HistoryEntry entry = draft.toBuilder()
                .sequence(sequence.incrementAndGet())
                .timestamp(OffsetDateTime.now())
                .errorMessage(sanitizeErrorMessage(draft.getErrorMessage()))
                .build();
        if (!enabled) {
            return entry;
        }
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > maxEntries) {
                entries.removeFirst();
            }
        }
        return entry;
    }

    /**
     * Most recent {@code n} entries, oldest first.
     *
     * @param n number of entries
     * @return entries
     */
    public List<HistoryEntry> tail(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<HistoryEntry> out = new ArrayList<>(n);
        synchronized (entries) {
            Iterator<HistoryEntry> it = entries.descendingIterator();
            while (it.hasNext() && out.size() < n) {
                out.add(it.next());
            }
        }
        Collections.reverse(out);
        return out;
    }

    /**
     * Most recent entries first.
     *
     * @param limit max entries; non-positive means all
     * @param successfulOnly skip failed entries
     * @return entries
     */
    public List<HistoryEntry> recent(int limit, boolean successfulOnly) {
        List<HistoryEntry> out = new ArrayList<>();
        synchronized (entries) {
            Iterator<HistoryEntry> it = entries.descendingIterator();
            while (it.hasNext() && (limit <= 0 || out.size() < limit)) {
                HistoryEntry e = it.next();
                if (!successfulOnly || e.isSuccess()) {
                    out.add(e);
                }
            }
        }
        return out;
    }

    public Optional<HistoryEntry> find(long seq) {
        synchronized (entries) {
            for (HistoryEntry e : entries) {
                if (e.getSequence() == seq) {
                    return Optional.of(e);
                }
            }
        }
        return Optional.empty();
    }

    public HistoryStats stats() {
        int total;
        int successful = 0;
        long successfulMs = 0;
        synchronized (entries) {
            total = entries.size();
            for (HistoryEntry e : entries) {
                if (e.isSuccess()) {
                    successful++;
                    successfulMs += e.getExecutionMs();
                }
            }
        }
        double rate = total == 0 ? 0.0 : (double) successful / total;
        double avg = successful == 0 ? 0.0 : (double) successfulMs / successful;
        return new HistoryStats(total, successful, total - successful, rate, avg);
    }

    /**
     * Drop every entry. Sequence numbers keep counting so replay never hits a recycled number.
     *
     * @return number of entries removed
     */
    public int clear() {
        synchronized (entries) {
            int removed = entries.size();
            entries.clear();
            return removed;
        }
    }

    /**
     * Successful past requests whose words overlap the given request by more than
     * {@value #SIMILARITY_THRESHOLD} (Jaccard index), best match first.
     *
     * @param requestText current request
     * @param limit max results
     * @return similar requests
     */
    public List<SimilarRequest> similar(String requestText, int limit) {
        Set<String> words = PromptBuilder.tokens(requestText);
        if (words.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<SimilarRequest> out = new ArrayList<>();
        for (HistoryEntry e : recent(0, true)) {
            double similarity = jaccard(words, PromptBuilder.tokens(e.getRequestText()));
            if (similarity > SIMILARITY_THRESHOLD) {
                out.add(new SimilarRequest(e, similarity));
            }
        }
        // stable sort keeps newer entries first among equal scores
        out.sort(Comparator.comparingDouble(SimilarRequest::similarity).reversed());
        return out.size() > limit ? List.copyOf(out.subList(0, limit)) : out;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        int common = 0;
        for (String word : a) {
            if (b.contains(word)) {
                common++;
            }
        }
        return (double) common / union.size();
    }

    static String sanitizeErrorMessage(String message) {
        if (message == null) {
            return null;
        }
        String sanitized = message.trim();
        sanitized = sanitized.replaceAll("(?i)^(error:\\s*)+", "");
        sanitized = sanitized.replaceAll("(?i)(password|passwd|token|secret|key)\\s*=\\s*[^\\s]+", "$1=***");
        sanitized = sanitized.replaceAll("://([^:/@\\s]+):[^@\\s]+@", "://$1:****@");
        if (sanitized.length() <= MAX_ERROR_LENGTH) {
            return sanitized;
        }
        return sanitized.substring(0, MAX_ERROR_LENGTH);
    }
}
