package com.williamcallahan.knowledgeindex.service.search;

import com.williamcallahan.knowledgeindex.config.SearchSettings;
import com.williamcallahan.knowledgeindex.domain.search.SearchHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Reciprocal rank fusion over per-source rank lists.
 *
 * <p>Each source is ranked independently (score descending, chunk id ascending, 1-indexed). A chunk's fused
 * score is the sum of {@code 1 / (k + rank)} over the sources that returned it, then min-max normalized
 * across the result. A single candidate or a zero range normalizes to 1.0. Ties are broken by the number of
 * contributing sources, then by chunk id.</p>
 */
@Component
public class RrfReranker implements SearchReranker {

    public static final String NAME = "RRF";

    private static final String UNTAGGED_SOURCE = "untagged";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean fusesRankLists() {
        return true;
    }

    @Override
    public List<SearchHit> rerank(String query, List<SearchHit> candidates, SearchSettings settings) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        int k = settings.rrfK();

        Map<String, List<SearchHit>> hitsBySource = new TreeMap<>();
        for (SearchHit candidate : candidates) {
            String source = candidate.source().isBlank() ? UNTAGGED_SOURCE : candidate.source();
            hitsBySource.computeIfAbsent(source, ignored -> new ArrayList<>()).add(candidate);
        }

        Map<String, FusedCandidate> fusedByChunk = new LinkedHashMap<>();
        for (Map.Entry<String, List<SearchHit>> sourceHits : hitsBySource.entrySet()) {
            List<SearchHit> ranked = new ArrayList<>(sourceHits.getValue());
            ranked.sort(SearchHitOrdering.BY_SCORE);
            Set<String> rankedChunkIds = new HashSet<>();
            int rank = 0;
            for (SearchHit hit : ranked) {
                if (!rankedChunkIds.add(hit.chunkId())) {
                    continue;
                }
                rank++;
                double contribution = 1.0 / (k + rank);
                fusedByChunk.computeIfAbsent(hit.chunkId(), ignored -> new FusedCandidate(hit))
                        .add(sourceHits.getKey(), contribution, hit);
            }
        }

        double minFused = Double.POSITIVE_INFINITY;
        double maxFused = Double.NEGATIVE_INFINITY;
        for (FusedCandidate fused : fusedByChunk.values()) {
            minFused = Math.min(minFused, fused.total);
            maxFused = Math.max(maxFused, fused.total);
        }
        double range = maxFused - minFused;
        boolean flat = fusedByChunk.size() == 1 || range <= 0.0;

        List<RankedHit> rankedHits = new ArrayList<>(fusedByChunk.size());
        for (FusedCandidate fused : fusedByChunk.values()) {
            double normalized = flat ? 1.0 : (fused.total - minFused) / range;
            rankedHits.add(new RankedHit(fused.toHit(normalized), fused.contributions.size()));
        }
        rankedHits.sort(Comparator.comparingDouble((RankedHit ranked) -> ranked.hit().score())
                .reversed()
                .thenComparing(Comparator.comparingInt(RankedHit::sourceCount).reversed())
                .thenComparing((RankedHit ranked) -> ranked.hit().chunkId()));

        List<SearchHit> result = new ArrayList<>(rankedHits.size());
        for (RankedHit ranked : rankedHits) {
            result.add(ranked.hit());
        }
        return result;
    }

    private record RankedHit(SearchHit hit, int sourceCount) {}

    private static final class FusedCandidate {
        private final SearchHit base;
        private final Map<String, Object> mergedMetadata = new LinkedHashMap<>();
        private final Map<String, Double> contributions = new TreeMap<>();
        private double total;

        private FusedCandidate(SearchHit base) {
            this.base = base;
        }

        private void add(String source, double contribution, SearchHit hit) {
            contributions.merge(source, contribution, Double::sum);
            total += contribution;
            for (Map.Entry<String, Object> entry : hit.metadata().entrySet()) {
                mergedMetadata.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }

        private SearchHit toHit(double normalizedScore) {
            Map<String, Object> metadata = new LinkedHashMap<>(mergedMetadata);
            metadata.put("rrfScore", total);
            metadata.put("reranker", NAME);
            metadata.put("sources", String.join(",", new TreeSet<>(contributions.keySet())));
            metadata.put("vectorContribution", contributions.getOrDefault(SearchHit.SOURCE_VECTOR, 0.0));
            metadata.put("keywordContribution", contributions.getOrDefault(SearchHit.SOURCE_KEYWORD, 0.0));
            return new SearchHit(base.chunkId(), base.documentId(), base.content(), normalizedScore, metadata);
        }
    }
}
