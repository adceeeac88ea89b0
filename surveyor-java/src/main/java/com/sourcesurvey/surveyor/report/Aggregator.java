package com.sourcesurvey.surveyor.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates evidence per category across a whole run and reduces it to
 * {@link CategoryResult}s.
 *
 * Only categories declared at construction are accepted. Records are kept in
 * arrival order, so examples in the reduced view follow detection order.
 * Not thread-safe: a run feeds one aggregator from a single thread, and partial
 * aggregators built elsewhere are combined with {@link #merge(Aggregator)}.
 */
public class Aggregator implements EvidenceSink {

    public static final int UNBOUNDED = 0;

    private final Set<Category> declared;
    private final Map<Category, List<EvidenceRecord>> records = new EnumMap<>(Category.class);

    public Aggregator(Set<Category> declared) {
        if (declared.isEmpty()) {
            throw new IllegalArgumentException("At least one category must be declared");
        }
        this.declared = Collections.unmodifiableSet(EnumSet.copyOf(declared));
        for (Category category : this.declared) {
            records.put(category, new ArrayList<>());
        }
    }

    @Override
    public void accept(EvidenceRecord record) {
        List<EvidenceRecord> bucket = records.get(record.category());
        if (bucket == null) {
            throw new IllegalArgumentException(
                    "Category '" + record.category() + "' is not declared by the active detectors");
        }
        bucket.add(record);
    }

    /**
     * Returns a new aggregator holding this aggregator's records followed by
     * {@code other}'s. Both must declare the same categories.
     */
    public Aggregator merge(Aggregator other) {
        if (!declared.equals(other.declared)) {
            throw new IllegalArgumentException(
                    "Cannot merge aggregators with different categories: " + declared + " vs " + other.declared);
        }
        Aggregator merged = new Aggregator(declared);
        for (Category category : declared) {
            List<EvidenceRecord> bucket = merged.records.get(category);
            bucket.addAll(records.get(category));
            bucket.addAll(other.records.get(category));
        }
        return merged;
    }

    public int count(Category category) {
        List<EvidenceRecord> bucket = records.get(category);
        return bucket == null ? 0 : bucket.size();
    }

    /** Unmodifiable view of the records seen so far for {@code category}. */
    public List<EvidenceRecord> records(Category category) {
        List<EvidenceRecord> bucket = records.get(category);
        return bucket == null ? List.of() : Collections.unmodifiableList(bucket);
    }

    /**
     * Folds every record into one result per declared category, in category
     * declaration order. Categories with no evidence are reported with a zero count.
     *
     * @param maxExamples examples kept per category; {@link #UNBOUNDED} keeps all
     */
    public List<CategoryResult> reduce(int maxExamples) {
        if (maxExamples < 0) {
            throw new IllegalArgumentException("maxExamples must be >= 0: " + maxExamples);
        }
        List<CategoryResult> results = new ArrayList<>();
        for (Map.Entry<Category, List<EvidenceRecord>> entry : records.entrySet()) {
            List<EvidenceRecord> bucket = entry.getValue();
            int shown = maxExamples == UNBOUNDED ? bucket.size() : Math.min(maxExamples, bucket.size());
            List<String> examples = new ArrayList<>(shown);
            for (int i = 0; i < shown; i++) {
                examples.add(bucket.get(i).describe());
            }
            results.add(new CategoryResult(entry.getKey(), bucket.size(), examples));
        }
        return results;
    }
}
