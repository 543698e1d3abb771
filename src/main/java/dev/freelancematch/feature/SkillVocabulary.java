package dev.freelancematch.feature;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TF-IDF vocabulary over freelancer skill lists.
 * <p>
 * Skill lists are joined with spaces and lower-cased; tokens are runs of two or more word
 * characters. Terms are indexed in alphabetical order. IDF is smoothed:
 * {@code ln((1 + n) / (1 + df)) + 1}. Transformed vectors are L2-normalised and ignore terms
 * outside the vocabulary.
 */
public class SkillVocabulary {

    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private Map<String, Integer> termIndex;
    private double[] idf;

    /**
     * Fit the vocabulary, replacing any earlier state.
     *
     * @param skillLists one skill list per freelancer
     */
    public void fit(List<? extends Collection<String>> skillLists) {
        if (skillLists == null || skillLists.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit skill vocabulary on an empty corpus");
        }

        Map<String, Integer> documentFrequency = new TreeMap<>();
        for (Collection<String> skills : skillLists) {
            Set<String> seen = new HashSet<>(tokenize(skills));
            for (String term : seen) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        Map<String, Integer> index = new HashMap<>();
        double[] weights = new double[documentFrequency.size()];
        int n = skillLists.size();
        int i = 0;
        for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
            index.put(entry.getKey(), i);
            weights[i] = Math.log((1.0 + n) / (1.0 + entry.getValue())) + 1.0;
            i++;
        }

        this.termIndex = index;
        this.idf = weights;
    }

    public boolean isFitted() {
        return termIndex != null;
    }

    /**
     * Transform a skill list into an L2-normalised TF-IDF vector.
     */
    public SkillVector transform(Collection<String> skills) {
        requireFitted();

        TreeMap<Integer, Integer> counts = new TreeMap<>();
        for (String token : tokenize(skills)) {
            Integer idx = termIndex.get(token);
            if (idx != null) {
                counts.merge(idx, 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return SkillVector.empty();
        }

        int[] indices = new int[counts.size()];
        double[] weights = new double[counts.size()];
        double sumSquares = 0.0;
        int pos = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            indices[pos] = entry.getKey();
            weights[pos] = entry.getValue() * idf[entry.getKey()];
            sumSquares += weights[pos] * weights[pos];
            pos++;
        }
        double norm = Math.sqrt(sumSquares);
        for (int k = 0; k < weights.length; k++) {
            weights[k] /= norm;
        }
        return SkillVector.of(indices, weights);
    }

    /**
     * Vocabulary terms in index order.
     */
    public List<String> terms() {
        requireFitted();
        return List.copyOf(new TreeSet<>(termIndex.keySet()));
    }

    public int size() {
        requireFitted();
        return termIndex.size();
    }

    double idf(String term) {
        requireFitted();
        Integer idx = termIndex.get(term);
        return idx != null ? idf[idx] : 0.0;
    }

    static List<String> tokenize(Collection<String> skills) {
        if (skills == null || skills.isEmpty()) {
            return List.of();
        }
        String text = String.join(" ", skills).toLowerCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private void requireFitted() {
        if (!isFitted()) {
            throw new NotFittedException("Skill vocabulary must be fitted before use");
        }
    }
}
