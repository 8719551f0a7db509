package com.delta.redirects.resolve.match;

import com.delta.redirects.resolve.model.RedirectCandidate;
import com.delta.redirects.resolve.model.ReferenceCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Picks the reference code that scores highest against a query code.
 *
 * <p>The scan is linear over the candidates in their given order. A candidate replaces the
 * current best only when it scores strictly higher, so on an exact tie the first candidate
 * seen wins, and a candidate scoring 0 never becomes a match.
 */
public final class BestMatchSelector {
    private final List<Entry> entries;

    private BestMatchSelector(List<Entry> entries) {
        this.entries = entries;
    }

    public static BestMatchSelector of(Collection<ReferenceCode> candidates) {
        List<Entry> entries = new ArrayList<>();
        if (candidates != null) {
            for (ReferenceCode candidate : candidates) {
                if (candidate == null || candidate.code() == null || candidate.code().isEmpty()) {
                    continue;
                }
                entries.add(new Entry(candidate.code(), SimilarityScorer.normalize(candidate.code())));
            }
        }
        return new BestMatchSelector(List.copyOf(entries));
    }

    public static RedirectCandidate bestMatch(String query, Collection<ReferenceCode> candidates) {
        return of(candidates).bestMatch(query);
    }

    public RedirectCandidate bestMatch(String query) {
        if (query == null || query.isEmpty() || entries.isEmpty()) {
            return null;
        }
        String normalizedQuery = SimilarityScorer.normalize(query);
        String bestCode = null;
        double bestPercent = SimilarityScorer.MIN_SCORE;
        for (Entry entry : entries) {
            double percent = SimilarityScorer.similarityOfNormalized(normalizedQuery, entry.normalized());
            if (percent > bestPercent) {
                bestPercent = percent;
                bestCode = entry.code();
            }
        }
        return bestCode == null ? null : new RedirectCandidate(bestCode, bestPercent);
    }

    public int size() {
        return entries.size();
    }

    private record Entry(String code, String normalized) {}
}
