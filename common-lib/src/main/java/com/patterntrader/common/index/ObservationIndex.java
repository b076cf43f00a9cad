package com.patterntrader.common.index;

import com.patterntrader.common.model.Direction;
import com.patterntrader.common.model.HorizonOutcome;
import com.patterntrader.common.model.Observation;

import java.util.BitSet;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only posting-set index over historical observations.
 *
 * <p>Every observation gets a dense integer id (its position in the load order). For each
 * {@link IndexField} the index keeps {@code value → BitSet of ids}; tiered retrieval is a
 * chain of {@link BitSet#and} calls. Values are matched case-insensitively. Multi-pattern
 * observations appear under each of their pattern labels.
 *
 * <p>No I/O after construction and no mutation, so one instance can be shared freely across
 * prediction worker threads.
 */
public final class ObservationIndex {

    private final List<Observation> observations;
    private final Map<IndexField, Map<String, BitSet>> postings = new EnumMap<>(IndexField.class);

    public ObservationIndex(List<Observation> observations) {
        this.observations = List.copyOf(observations);
        for (IndexField field : IndexField.values()) {
            postings.put(field, new HashMap<>());
        }
        for (int id = 0; id < this.observations.size(); id++) {
            Observation o = this.observations.get(id);
            for (String p : o.patterns()) {
                add(IndexField.PATTERN, p, id);
            }
            add(IndexField.INSTRUMENT,      o.instrument(),     id);
            add(IndexField.SECTOR,          o.sector(),         id);
            add(IndexField.TIMEFRAME,       o.timeframe(),      id);
            add(IndexField.TREND,           o.trend(),          id);
            add(IndexField.VOLATILITY_ZONE, o.volatilityZone(), id);
            add(IndexField.PRICE_POSITION,  o.pricePosition(),  id);
            add(IndexField.REGIME,          o.regime(),         id);
        }
    }

    private void add(IndexField field, String value, int id) {
        String key = normalize(value);
        if (key == null) return;
        postings.get(field).computeIfAbsent(key, k -> new BitSet()).set(id);
    }

    static String normalize(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase();
        return v.isEmpty() ? null : v;
    }

    public int size() {
        return observations.size();
    }

    public Observation get(int id) {
        return observations.get(id);
    }

    /** Copy of the posting set for {@code value}; empty when the value never occurs. */
    public BitSet ids(IndexField field, String value) {
        String key = normalize(value);
        BitSet set = key == null ? null : postings.get(field).get(key);
        return set == null ? new BitSet() : (BitSet) set.clone();
    }

    /**
     * Narrows {@code candidates} to observations whose {@code field} equals {@code value}.
     * A null or blank value leaves the set untouched, matching "unconstrained".
     */
    public BitSet intersect(BitSet candidates, IndexField field, String value) {
        BitSet result = (BitSet) candidates.clone();
        if (normalize(value) == null) return result;
        result.and(ids(field, value));
        return result;
    }

    /** Number of observations carrying {@code value} for {@code field}. */
    public int count(IndexField field, String value) {
        String key = normalize(value);
        BitSet set = key == null ? null : postings.get(field).get(key);
        return set == null ? 0 : set.cardinality();
    }

    /**
     * Unconditional direction frequencies at {@code horizon} over all observations that
     * carry an outcome for it. Falls back to uniform rates on an empty dataset.
     */
    public BaseRates baseRates(int horizon) {
        int bullish = 0;
        int bearish = 0;
        int neutral = 0;
        for (Observation o : observations) {
            HorizonOutcome out = o.outcome(horizon);
            if (out == null) continue;
            Direction d = out.direction() == null ? Direction.NEUTRAL : out.direction();
            switch (d) {
                case BULLISH -> bullish++;
                case BEARISH -> bearish++;
                case NEUTRAL -> neutral++;
            }
        }
        int total = bullish + bearish + neutral;
        if (total == 0) return BaseRates.uniform(horizon);
        return new BaseRates(horizon,
            (double) bullish / total, (double) bearish / total, (double) neutral / total, total);
    }
}
