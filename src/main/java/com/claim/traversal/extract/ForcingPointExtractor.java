package com.claim.traversal.extract;

import com.claim.traversal.core.model.Claim;
import com.claim.traversal.core.model.Conditional;
import com.claim.traversal.core.model.ConflictEdge;
import com.claim.traversal.core.model.ConflictOption;
import com.claim.traversal.core.model.ForcingPoint;
import com.claim.traversal.core.model.ForcingPointType;
import com.claim.traversal.graph.ConditionalQuestions;
import com.claim.traversal.graph.GraphNormalizer;
import com.claim.traversal.graph.NormalizedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a normalized decision graph into the ordered list of forcing points.
 *
 * <p>Conditionals become tier 0 forcing points, conflict edges become forcing points on
 * the configured conflict tier. The result is stably sorted by tier, so extraction order
 * is kept within a tier.</p>
 *
 * <p>Conflict ids ({@code fp_conflict_{pairKey}}) are deterministic across calls.
 * Unlabeled conditionals get {@code cond_{n}} from a counter scoped to one call; callers
 * needing stable ids for those must keep the extracted list instead of re-extracting.</p>
 */
public class ForcingPointExtractor {
    private static final Logger log = LoggerFactory.getLogger(ForcingPointExtractor.class);

    static final String CONFLICT_ID_PREFIX = "fp_conflict_";
    static final String SYNTHETIC_CONDITIONAL_PREFIX = "cond_";
    static final int CONDITIONAL_TIER = 0;

    private final ExtractionOptions options;

    public ForcingPointExtractor() {
        this(ExtractionOptions.defaults());
    }

    public ForcingPointExtractor(ExtractionOptions options) {
        this.options = options != null ? options : ExtractionOptions.defaults();
    }

    public ExtractionOptions getOptions() {
        return options;
    }

    /**
     * Normalizes an untyped upstream graph and extracts its forcing points.
     * An already normalized graph is used as is.
     */
    public List<ForcingPoint> extract(Object upstreamGraph) {
        if (upstreamGraph instanceof NormalizedGraph graph) {
            return extract(graph);
        }
        return extract(GraphNormalizer.normalize(upstreamGraph));
    }

    public List<ForcingPoint> extract(NormalizedGraph graph) {
        if (graph == null) {
            return new ArrayList<>();
        }
        Map<String, Claim> claimsById = graph.claimsById();
        List<ForcingPoint> forcingPoints = new ArrayList<>();

        int conditionalCounter = 0;
        for (Conditional conditional : graph.conditionals()) {
            List<String> affected = new ArrayList<>(new LinkedHashSet<>(conditional.affectedClaims()));
            if (affected.isEmpty()) {
                continue;
            }
            String syntheticId = SYNTHETIC_CONDITIONAL_PREFIX + conditionalCounter++;
            String id = conditional.hasId() ? conditional.id() : syntheticId;
            forcingPoints.add(toConditionalForcingPoint(id, conditional, affected, claimsById));
        }
        int conditionalCount = forcingPoints.size();

        Set<String> seenPairs = new HashSet<>();
        for (ConflictEdge edge : graph.edges()) {
            String pairKey = edge.pairKey();
            if (!seenPairs.add(pairKey)) {
                continue;
            }
            Claim a = claimsById.get(edge.from());
            Claim b = claimsById.get(edge.to());
            if (a == null || b == null) {
                log.debug("forcing-point.skipped pair={} reason=unknown-claim", pairKey);
                continue;
            }
            forcingPoints.add(toConflictForcingPoint(pairKey, edge, a, b, graph.blockingGatesFor(pairKey)));
        }

        forcingPoints.sort(Comparator.comparingInt(ForcingPoint::getTier));

        log.debug("forcing-points.extracted conditionals={} conflicts={}",
                conditionalCount, forcingPoints.size() - conditionalCount);
        return forcingPoints;
    }

    private ForcingPoint toConditionalForcingPoint(String id, Conditional conditional,
                                                   List<String> affected, Map<String, Claim> claimsById) {
        Set<String> provenance = new TreeSet<>();
        for (String claimId : affected) {
            Claim claim = claimsById.get(claimId);
            if (claim != null) {
                provenance.addAll(claim.getSourceStatementIds());
            }
        }

        String rawQuestion = conditional.question() != null ? conditional.question().trim() : "";
        String question;
        String condition;
        if (ConditionalQuestions.isPlaceholder(rawQuestion, id)
                || ConditionalQuestions.isPlaceholder(rawQuestion, conditional.id())) {
            question = options.getFallbackConditionalQuestion();
            condition = affectedSummary(affected, claimsById);
        } else {
            question = rawQuestion;
            condition = rawQuestion;
        }

        return ForcingPoint.builder()
                .id(id)
                .type(ForcingPointType.CONDITIONAL)
                .tier(CONDITIONAL_TIER)
                .question(question)
                .condition(condition)
                .affectedClaims(affected)
                .sourceStatementIds(new ArrayList<>(provenance))
                .build();
    }

    /**
     * Names the first few affected claims, e.g. {@code "Affects: A, B, C +2 more"}.
     */
    String affectedSummary(List<String> affected, Map<String, Claim> claimsById) {
        List<String> labels = new ArrayList<>(affected.size());
        for (String claimId : affected) {
            Claim claim = claimsById.get(claimId);
            String label = claim != null ? claim.getLabel().trim() : claimId;
            if (!label.isEmpty()) {
                labels.add(label);
            }
        }
        if (labels.isEmpty()) {
            return "Affects " + affected.size() + " claim(s)";
        }
        int limit = options.getAffectedLabelPreviewLimit();
        String summary = String.join(", ", labels.subList(0, Math.min(limit, labels.size())));
        if (labels.size() > limit) {
            summary += " +" + (labels.size() - limit) + " more";
        }
        return "Affects: " + summary;
    }

    private ForcingPoint toConflictForcingPoint(String pairKey, ConflictEdge edge, Claim a, Claim b,
                                                List<String> blockingGates) {
        Set<String> provenance = new TreeSet<>();
        provenance.addAll(a.getSourceStatementIds());
        provenance.addAll(b.getSourceStatementIds());
        provenance.addAll(edge.sourceStatementIds());

        Set<String> gateIds = new TreeSet<>();
        for (String gateId : blockingGates) {
            String trimmed = gateId.trim();
            if (!trimmed.isEmpty()) {
                gateIds.add(trimmed);
            }
        }

        String versus = a.getLabel() + " vs " + b.getLabel();
        String question = edge.question() != null && !edge.question().isBlank()
                ? edge.question().trim()
                : "Choose between: " + versus;

        return ForcingPoint.builder()
                .id(CONFLICT_ID_PREFIX + pairKey)
                .type(ForcingPointType.CONFLICT)
                .tier(options.getConflictTier())
                .question(question)
                .condition(versus)
                .options(List.of(ConflictOption.of(a), ConflictOption.of(b)))
                .blockedByGateIds(new ArrayList<>(gateIds))
                .sourceStatementIds(new ArrayList<>(provenance))
                .build();
    }
}
