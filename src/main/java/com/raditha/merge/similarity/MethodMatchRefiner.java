package com.raditha.merge.similarity;

import com.raditha.merge.config.FuzzyMatchWeights;
import com.raditha.merge.model.MatchResult;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Pairs definitions that did not match by signature, typically because a
 * method was renamed or its parameters changed.
 * <p>
 * Candidates are scored by weighted name and parameter similarity and
 * assigned greedily by descending score. Every node takes part in at most
 * one pair.
 */
public class MethodMatchRefiner {

    private static final Logger logger = LoggerFactory.getLogger(MethodMatchRefiner.class);

    public static final double DEFAULT_THRESHOLD = 0.5;

    private final double threshold;
    private final FuzzyMatchWeights weights;
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

    public MethodMatchRefiner() {
        this(DEFAULT_THRESHOLD, FuzzyMatchWeights.balanced());
    }

    /**
     * @param threshold minimum combined score for a pair (0.0-1.0)
     * @param weights   weights for name and parameter similarity
     */
    public MethodMatchRefiner(double threshold, FuzzyMatchWeights weights) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        if (weights == null) {
            throw new IllegalArgumentException("weights cannot be null");
        }
        this.threshold = threshold;
        this.weights = weights;
    }

    public double getThreshold() {
        return threshold;
    }

    public FuzzyMatchWeights getWeights() {
        return weights;
    }

    /**
     * Find the best pairing between unmatched template and destination definitions.
     * Nodes that are not definitions are ignored.
     *
     * @param templateDefs unmatched template nodes
     * @param destDefs     unmatched destination nodes
     * @return pairs ordered by descending score
     */
    public List<MatchResult> refine(List<Node> templateDefs, List<Node> destDefs) {
        List<Node> templates = definitionsOf(templateDefs);
        List<Node> destinations = definitionsOf(destDefs);
        if (templates.isEmpty() || destinations.isEmpty()) {
            return List.of();
        }

        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < templates.size(); i++) {
            for (int j = 0; j < destinations.size(); j++) {
                double score = score(templates.get(i), destinations.get(j));
                if (score >= threshold) {
                    candidates.add(new Candidate(i, j, score));
                }
            }
        }
        // List.sort is stable, so ties keep template order, then destination order
        candidates.sort(Comparator.comparingDouble(Candidate::score).reversed());

        Set<Integer> usedTemplates = new HashSet<>();
        Set<Integer> usedDestinations = new HashSet<>();
        List<MatchResult> matches = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (usedTemplates.contains(candidate.templateIndex())
                    || usedDestinations.contains(candidate.destIndex())) {
                continue;
            }
            usedTemplates.add(candidate.templateIndex());
            usedDestinations.add(candidate.destIndex());
            matches.add(new MatchResult(templates.get(candidate.templateIndex()),
                    destinations.get(candidate.destIndex()), candidate.score()));
        }

        logger.debug("Fuzzy matched {} of {} template definition(s)", matches.size(), templates.size());
        return matches;
    }

    /**
     * Combined similarity of two definitions.
     */
    public double score(Node template, Node dest) {
        double nameSimilarity = levenshtein.calculate(nameOf(template), nameOf(dest));
        double paramSimilarity = parameterSimilarity(template.parameters(), dest.parameters());
        return weights.combine(nameSimilarity, paramSimilarity);
    }

    /**
     * Compare parameter name sets. Both empty is a perfect match and exactly
     * one empty is no match. Otherwise the overlap relative to the larger set
     * is blended with the ratio of the set sizes.
     */
    public double parameterSimilarity(List<String> params1, List<String> params2) {
        Set<String> set1 = namesOf(params1);
        Set<String> set2 = namesOf(params2);
        if (set1.isEmpty() && set2.isEmpty()) {
            return 1.0;
        }
        if (set1.isEmpty() || set2.isEmpty()) {
            return 0.0;
        }

        Set<String> common = new HashSet<>(set1);
        common.retainAll(set2);
        int larger = Math.max(set1.size(), set2.size());
        int smaller = Math.min(set1.size(), set2.size());

        double overlap = (double) common.size() / larger;
        double countRatio = (double) smaller / larger;
        return overlap * 0.7 + countRatio * 0.3;
    }

    private static Set<String> namesOf(List<String> params) {
        Set<String> names = new HashSet<>();
        if (params != null) {
            params.stream().filter(Objects::nonNull).forEach(names::add);
        }
        return names;
    }

    private static String nameOf(Node node) {
        return node.name() == null ? "" : node.name();
    }

    private static List<Node> definitionsOf(List<Node> nodes) {
        if (nodes == null) {
            return List.of();
        }
        return nodes.stream()
                .filter(Objects::nonNull)
                .filter(node -> node.kind() == NodeKind.DEFINITION)
                .toList();
    }

    private record Candidate(int templateIndex, int destIndex, double score) {
    }
}
