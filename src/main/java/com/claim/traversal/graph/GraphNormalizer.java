package com.claim.traversal.graph;

import com.claim.traversal.core.model.Claim;
import com.claim.traversal.core.model.Conditional;
import com.claim.traversal.core.model.ConflictEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles the several upstream graph shapes into one {@link NormalizedGraph}.
 *
 * <p>Input is an untyped tree (maps, lists, scalars), usually straight out of a JSON
 * parser. Each field is validated on its own and invalid members are discarded, so
 * normalization never fails as a whole:</p>
 * <ul>
 *   <li>Claims need a non-blank id; label defaults to the id, text falls back to description.</li>
 *   <li>Edges come from the first shape present: {@code edges[]}, then {@code tensions[]},
 *       then each claim's {@code conflicts[]}. See {@link EdgeSource}.</li>
 *   <li>Conditionals from {@code conditionals[]} and from {@code tiers[].gates[]} entries of
 *       type {@code conditional} are merged by id.</li>
 * </ul>
 */
public final class GraphNormalizer {
    private static final Logger log = LoggerFactory.getLogger(GraphNormalizer.class);

    private static final String CONFLICT = "conflict";
    private static final String CONDITIONAL = "conditional";
    private static final String UNLABELED_KEY_PREFIX = "\u0000unlabeled#";

    private GraphNormalizer() {
        // utility class
    }

    /**
     * Normalizes an upstream graph. Never throws; a {@code null} or non-object input
     * yields an empty graph.
     */
    public static NormalizedGraph normalize(Object input) {
        if (GraphFields.asMap(input) == null) {
            log.debug("graph.normalize input is not an object, treating as empty");
            return NormalizedGraph.empty();
        }
        List<Claim> claims = normalizeClaims(input);
        EdgeResult edgeResult = normalizeEdges(input);
        List<Conditional> conditionals = normalizeConditionals(input);

        log.debug("graph.normalized claims={} edges={} source={} conditionals={}",
                claims.size(), edgeResult.edges.size(), edgeResult.source, conditionals.size());

        return new NormalizedGraph(claims, edgeResult.edges, conditionals,
                edgeResult.conflictBlocks, edgeResult.source, edgeResult.dropped);
    }

    // ========== Claims ==========

    static List<Claim> normalizeClaims(Object input) {
        List<?> rawClaims = GraphFields.list(input, "claims");
        if (rawClaims == null) {
            return List.of();
        }
        List<Claim> claims = new ArrayList<>(rawClaims.size());
        for (Object raw : rawClaims) {
            String id = GraphFields.id(raw, "id");
            if (id.isEmpty()) {
                continue;
            }
            String label = GraphFields.firstText(raw, "label");
            String text = GraphFields.string(raw, "text");
            if (text == null) {
                text = GraphFields.string(raw, "description");
            }
            claims.add(Claim.builder()
                    .id(id)
                    .label(label != null ? label : id)
                    .text(text)
                    .sourceStatementIds(GraphFields.idList(raw, "sourceStatementIds"))
                    .build());
        }
        return claims;
    }

    // ========== Edges ==========

    private static final class EdgeResult {
        final List<ConflictEdge> edges = new ArrayList<>();
        final Map<String, List<String>> conflictBlocks = new LinkedHashMap<>();
        EdgeSource source = EdgeSource.CLAIM_CONFLICTS;
        int dropped;
    }

    private static EdgeResult normalizeEdges(Object input) {
        EdgeResult result = new EdgeResult();

        List<?> explicitEdges = GraphFields.list(input, "edges");
        if (explicitEdges != null) {
            result.source = EdgeSource.EDGES;
            int considered = 0;
            for (Object raw : explicitEdges) {
                if (raw == null) {
                    continue;
                }
                considered++;
                if (isValidConflictEdge(raw)) {
                    result.edges.add(new ConflictEdge(
                            GraphFields.id(raw, "from"),
                            GraphFields.id(raw, "to"),
                            GraphFields.firstText(raw, "question"),
                            GraphFields.idList(raw, "sourceStatementIds")));
                }
            }
            result.dropped = considered - result.edges.size();
            if (result.dropped > 0) {
                log.warn("graph.edges.dropped count={} of={}", result.dropped, considered);
            }
            return result;
        }

        List<?> tensions = GraphFields.list(input, "tensions");
        if (tensions != null && !tensions.isEmpty()) {
            result.source = EdgeSource.TENSIONS;
            Set<String> seen = new HashSet<>();
            for (Object tension : tensions) {
                String aId = GraphFields.id(tension, "claimAId");
                String bId = GraphFields.id(tension, "claimBId");
                if (aId.isEmpty() || bId.isEmpty()) {
                    continue;
                }
                String pairKey = ConflictEdge.pairKey(aId, bId);
                if (!seen.add(pairKey)) {
                    continue;
                }
                result.edges.add(new ConflictEdge(aId, bId,
                        GraphFields.firstText(tension, "question"),
                        GraphFields.idList(tension, "sourceStatementIds")));
                if (GraphFields.list(tension, "blockedByGates") != null) {
                    result.conflictBlocks.put(pairKey, GraphFields.idList(tension, "blockedByGates"));
                }
            }
            return result;
        }

        result.source = EdgeSource.CLAIM_CONFLICTS;
        List<?> rawClaims = GraphFields.list(input, "claims");
        if (rawClaims == null) {
            return result;
        }
        Set<String> seen = new HashSet<>();
        for (Object claim : rawClaims) {
            String fromId = GraphFields.id(claim, "id");
            if (fromId.isEmpty()) {
                continue;
            }
            List<?> conflicts = GraphFields.list(claim, "conflicts");
            if (conflicts == null) {
                continue;
            }
            for (Object conflict : conflicts) {
                String toId = GraphFields.id(conflict, "claimId");
                if (toId.isEmpty()) {
                    continue;
                }
                if (!seen.add(ConflictEdge.pairKey(fromId, toId))) {
                    continue;
                }
                result.edges.add(new ConflictEdge(fromId, toId,
                        GraphFields.firstText(conflict, "question"), List.of()));
            }
        }
        return result;
    }

    /**
     * An explicit edge is kept only when it is an object with non-blank string
     * {@code from}/{@code to}, {@code type == "conflict"}, and a question that is
     * absent or a string.
     */
    static boolean isValidConflictEdge(Object raw) {
        if (GraphFields.asMap(raw) == null) {
            return false;
        }
        if (!GraphFields.isNonBlankString(GraphFields.get(raw, "from"))
                || !GraphFields.isNonBlankString(GraphFields.get(raw, "to"))) {
            return false;
        }
        if (!CONFLICT.equals(GraphFields.get(raw, "type"))) {
            return false;
        }
        Object question = GraphFields.get(raw, "question");
        return question == null || question instanceof String;
    }

    // ========== Conditionals ==========

    private static List<Conditional> normalizeConditionals(Object input) {
        Map<String, Conditional> byKey = new LinkedHashMap<>();
        int unlabeled = 0;

        List<?> rawConditionals = GraphFields.list(input, "conditionals");
        if (rawConditionals != null) {
            for (Object raw : rawConditionals) {
                Conditional next = readConditional(raw, "affectedClaims");
                if (next == null) {
                    continue;
                }
                if (next.hasId()) {
                    byKey.merge(next.id(), next, GraphNormalizer::mergeConditionals);
                } else {
                    byKey.put(UNLABELED_KEY_PREFIX + unlabeled++, next);
                }
            }
        }

        List<?> tiers = GraphFields.list(input, "tiers");
        if (tiers != null) {
            for (Object tier : tiers) {
                List<?> gates = GraphFields.list(tier, "gates");
                if (gates == null) {
                    continue;
                }
                for (Object gate : gates) {
                    if (!CONDITIONAL.equals(GraphFields.get(gate, "type"))) {
                        continue;
                    }
                    Conditional next = readConditional(gate, "blockedClaims");
                    if (next == null) {
                        continue;
                    }
                    if (next.hasId()) {
                        byKey.merge(next.id(), next, GraphNormalizer::mergeConditionals);
                    } else {
                        byKey.put(UNLABELED_KEY_PREFIX + unlabeled++, next);
                    }
                }
            }
        }

        return new ArrayList<>(byKey.values());
    }

    /**
     * Reads one conditional or gate object. Returns {@code null} when it gates no claims.
     */
    private static Conditional readConditional(Object raw, String affectedField) {
        if (GraphFields.asMap(raw) == null) {
            return null;
        }
        List<String> affected = dedupe(GraphFields.idList(raw, affectedField));
        if (affected.isEmpty()) {
            return null;
        }
        String id = GraphFields.id(raw, "id");
        String question = GraphFields.firstText(raw, "question", "condition", "prompt");
        if (question == null) {
            question = id;
        }
        return new Conditional(id.isEmpty() ? null : id, question, affected,
                dedupe(GraphFields.idList(raw, "sourceStatementIds")));
    }

    /**
     * Unions affected claims and provenance; keeps the first real question,
     * otherwise the later real question, otherwise the id.
     */
    static Conditional mergeConditionals(Conditional prev, Conditional next) {
        Set<String> affected = new LinkedHashSet<>(prev.affectedClaims());
        affected.addAll(next.affectedClaims());
        Set<String> sources = new LinkedHashSet<>(prev.sourceStatementIds());
        sources.addAll(next.sourceStatementIds());

        String question;
        if (ConditionalQuestions.isReal(prev.question(), prev.id())) {
            question = prev.question();
        } else if (ConditionalQuestions.isReal(next.question(), next.id())) {
            question = next.question();
        } else {
            question = prev.id();
        }
        return new Conditional(prev.id(), question, new ArrayList<>(affected), new ArrayList<>(sources));
    }

    private static List<String> dedupe(List<String> ids) {
        return new ArrayList<>(new LinkedHashSet<>(ids));
    }
}
