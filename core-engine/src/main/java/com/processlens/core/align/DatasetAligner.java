package com.processlens.core.align;

import com.processlens.core.model.Dataset;
import com.processlens.core.model.SeriesInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Full outer join of sources on timestamp.
 *
 * <p>
 * The result is indexed by the union of every timestamp seen; positions a
 * source does not cover hold {@code NaN}. Sources are merged in the given
 * order and the first source to provide a series name keeps it: a later
 * column with the same name is discarded and reported.
 * </p>
 *
 * @since 1.0.0
 */
public final class DatasetAligner {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetAligner.class);

    private DatasetAligner() {
        // utility class — not instantiable
    }

    /**
     * Outcome of a merge: the new dataset and a note per discarded column.
     */
    public static final class MergeResult {
        private final Dataset dataset;
        private final List<String> discarded;

        MergeResult(Dataset dataset, List<String> discarded) {
            this.dataset = dataset;
            this.discarded = List.copyOf(discarded);
        }

        public Dataset getDataset() {
            return dataset;
        }

        /**
         * @return names of columns dropped because an earlier source already
         *         provided them
         */
        public List<String> getDiscarded() {
            return discarded;
        }
    }

    /**
     * Merge {@code sources} into {@code base}, producing a new snapshot.
     *
     * @param base    existing dataset (use {@link Dataset#empty()} for a fresh
     *                load); never modified
     * @param sources parsed sources in load order
     * @return merged dataset plus discarded column names
     */
    public static MergeResult merge(Dataset base, List<SourceFrame> sources) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(sources, "sources must not be null");

        TreeSet<LocalDateTime> union = new TreeSet<>(base.getIndex());
        for (SourceFrame source : sources) {
            union.addAll(source.getTimes());
        }
        List<LocalDateTime> index = new ArrayList<>(union);
        Map<LocalDateTime, Integer> position = new HashMap<>(index.size() * 2);
        for (int i = 0; i < index.size(); i++) {
            position.put(index.get(i), i);
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        Map<String, SeriesInfo> info = new LinkedHashMap<>();
        List<String> discarded = new ArrayList<>();

        for (String name : base.getSeriesNames()) {
            columns.put(name, reindex(base.getIndex(), base.getValues(name), position, index.size()));
            info.put(name, base.getInfo(name));
        }

        for (SourceFrame source : sources) {
            for (Map.Entry<String, double[]> e : source.getColumns().entrySet()) {
                String name = e.getKey();
                if (columns.containsKey(name)) {
                    LOG.warn("Series '{}' from source '{}' already loaded, keeping the first",
                            name, source.getSourceId());
                    discarded.add(name);
                    continue;
                }
                columns.put(name, reindex(source.getTimes(), e.getValue(), position, index.size()));
                info.put(name, source.getInfo().get(name));
            }
        }

        Dataset merged = new Dataset(index, columns, info);
        LOG.info("Aligned {} source(s): {} row(s), {} series", sources.size(),
                merged.rowCount(), merged.seriesCount());
        return new MergeResult(merged, discarded);
    }

    private static double[] reindex(List<LocalDateTime> times, double[] values,
            Map<LocalDateTime, Integer> position, int size) {
        double[] out = new double[size];
        Arrays.fill(out, Double.NaN);
        for (int i = 0; i < times.size(); i++) {
            out[position.get(times.get(i))] = values[i];
        }
        return out;
    }
}
