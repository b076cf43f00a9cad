package com.patterntrader.common.index;

import com.patterntrader.common.model.Observation;
import com.patterntrader.common.prediction.PredictorSettings;

import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bounds how much any single instrument or sector can contribute to a candidate pool.
 *
 * <p>Oversized groups are thinned by even, deterministic subsampling over their time-ordered
 * members ({@code pick[i] = members[floor(i * n / limit)]}), so the kept sample still spans the
 * group's whole history. Candidates with no instrument or sector form one group of their own and
 * are capped like any other. The querying instrument gets the tighter limit
 * {@code min(maxPerInstrument, max(3, n / 5))} to stop it from dominating its own prediction.
 *
 * <p>After capping, same-sector candidates are preferred, the pool is cut to {@code 3 × topK},
 * then the most recent {@code topK} are returned, newest first.
 */
public final class CandidateCapper {

    private static final Comparator<Integer> BY_ID = Comparator.naturalOrder();

    private CandidateCapper() {}

    public static List<Integer> cap(ObservationIndex index, BitSet candidates,
                                    String queryInstrument, String querySector,
                                    PredictorSettings settings) {
        Comparator<Integer> oldestFirst = Comparator
            .comparing((Integer id) -> timestampOf(index, id))
            .thenComparing(BY_ID);

        // per instrument
        Map<String, List<Integer>> byInstrument = groupBy(index, candidates, IndexField.INSTRUMENT);
        String queryKey = ObservationIndex.normalize(queryInstrument);
        List<Integer> instrumentCapped = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> e : byInstrument.entrySet()) {
            List<Integer> members = e.getValue();
            members.sort(oldestFirst);
            int limit = settings.maxPerInstrument();
            if (e.getKey() != null && e.getKey().equals(queryKey)) {
                limit = Math.min(settings.maxPerInstrument(), Math.max(3, members.size() / 5));
            }
            instrumentCapped.addAll(evenSample(members, limit));
        }

        // per sector
        BitSet afterInstrument = new BitSet();
        instrumentCapped.forEach(afterInstrument::set);
        Map<String, List<Integer>> bySector = groupBy(index, afterInstrument, IndexField.SECTOR);
        List<Integer> sectorCapped = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> e : bySector.entrySet()) {
            List<Integer> members = e.getValue();
            members.sort(oldestFirst);
            sectorCapped.addAll(evenSample(members, settings.maxPerSector()));
        }

        String sectorKey = ObservationIndex.normalize(querySector);
        Comparator<Integer> newestFirst = Comparator
            .comparing((Integer id) -> timestampOf(index, id)).reversed()
            .thenComparing(BY_ID);
        Comparator<Integer> sameSectorFirst = Comparator
            .comparing((Integer id) -> sectorKey == null
                || !sectorKey.equals(ObservationIndex.normalize(index.get(id).sector())))
            .thenComparing(newestFirst);

        sectorCapped.sort(sameSectorFirst);
        List<Integer> pool = new ArrayList<>(sectorCapped.subList(0, Math.min(sectorCapped.size(), settings.topK() * 3)));
        pool.sort(newestFirst);
        return List.copyOf(pool.subList(0, Math.min(pool.size(), settings.topK())));
    }

    /** Evenly spaced, deterministic subsample of at most {@code limit} members. */
    static List<Integer> evenSample(List<Integer> members, int limit) {
        int n = members.size();
        if (n <= limit) return members;
        double step = (double) n / limit;
        List<Integer> picked = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            picked.add(members.get((int) (i * step)));
        }
        return picked;
    }

    private static Map<String, List<Integer>> groupBy(ObservationIndex index, BitSet ids, IndexField field) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int id = ids.nextSetBit(0); id >= 0; id = ids.nextSetBit(id + 1)) {
            Observation o = index.get(id);
            String value = field == IndexField.INSTRUMENT ? o.instrument() : o.sector();
            groups.computeIfAbsent(ObservationIndex.normalize(value), k -> new ArrayList<>()).add(id);
        }
        return groups;
    }

    private static Instant timestampOf(ObservationIndex index, int id) {
        return Objects.requireNonNullElse(index.get(id).timestamp(), Instant.EPOCH);
    }
}
