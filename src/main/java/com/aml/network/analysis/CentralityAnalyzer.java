package com.aml.network.analysis;

import com.aml.network.core.model.CentralityRecord;
import com.aml.network.core.model.RelationshipEdge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Degree-based centrality over a candidate set of entities.
 *
 * <p>Only active edges with both endpoints among the candidates are counted. Closeness
 * and betweenness are degree-derived approximations, not shortest-path centralities.</p>
 */
public class CentralityAnalyzer {

    public static final double HIGH_CONFIDENCE = 0.8;

    /**
     * Computes one record per candidate, in candidate order. Candidates without
     * qualifying edges get an all-zero record.
     */
    public List<CentralityRecord> analyze(Collection<String> candidateIds, Collection<RelationshipEdge> edges,
                                          boolean includeAdvanced) {
        Set<String> candidates = new LinkedHashSet<>(candidateIds);
        double normalizer = Math.max(candidates.size() - 1, 1);
        List<CentralityRecord> records = new ArrayList<>(candidates.size());

        for (String entityId : candidates) {
            int degree = 0;
            int highConfidence = 0;
            double weighted = 0.0;
            double riskWeighted = 0.0;
            for (RelationshipEdge edge : edges) {
                if (!edge.isActive() || edge.isSelfLoop() || !edge.connects(entityId)
                        || !candidates.contains(edge.otherEnd(entityId))) {
                    continue;
                }
                degree++;
                weighted += edge.getConfidence();
                riskWeighted += edge.riskWeightedConfidence();
                if (edge.getConfidence() >= HIGH_CONFIDENCE) {
                    highConfidence++;
                }
            }
            if (degree == 0) {
                records.add(CentralityRecord.zero(entityId, includeAdvanced));
                continue;
            }
            double normalized = degree / normalizer;
            double composite = 0.4 * normalized + 0.3 * (weighted / degree) + 0.3 * riskWeighted;
            records.add(new CentralityRecord(entityId, degree, normalized, weighted, riskWeighted,
                    highConfidence, composite,
                    includeAdvanced ? Math.min(normalized * 1.2, 1.0) : null,
                    includeAdvanced ? normalized * 0.8 : null));
        }
        return records;
    }
}
