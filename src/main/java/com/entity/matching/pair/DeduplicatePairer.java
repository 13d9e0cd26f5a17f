package com.entity.matching.pair;

import com.entity.matching.core.model.Row;
import com.entity.matching.core.model.StructuralException;
import com.entity.matching.core.model.Table;
import com.entity.matching.index.BlockingIndex;
import com.entity.matching.index.BucketKey;
import com.entity.matching.index.IndexedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pairs rows of a single table: every 2-combination of rows inside each bucket,
 * without self pairs or reversed duplicates. Both frames are the same table.
 */
public class DeduplicatePairer<K extends Comparable<K>> implements Pairer<K> {
    private static final Logger log = LoggerFactory.getLogger(DeduplicatePairer.class);

    private final Table<K> table;
    private final BlockingIndex index;

    /**
     * @throws StructuralException if the table has duplicated keys
     */
    public DeduplicatePairer(Table<K> table, BlockingIndex index) {
        if (!table.hasUniqueKeys()) {
            throw new StructuralException("Table keys contain duplicates.");
        }
        this.table = table;
        this.index = index;
    }

    @Override
    public Table<K> frameA() {
        return table;
    }

    @Override
    public Table<K> frameB() {
        return table;
    }

    @Override
    public List<RecordPair<K>> pairs() {
        IndexedTable<K> indexed = index.index(table);

        List<RecordPair<K>> pairs = new ArrayList<>();
        Set<List<K>> seen = new HashSet<>();
        for (BucketKey key : indexed.keys()) {
            List<Row<K>> rows = indexed.bucket(key).rows();
            for (int i = 0; i < rows.size(); i++) {
                for (int j = i + 1; j < rows.size(); j++) {
                    Row<K> rowA = rows.get(i);
                    Row<K> rowB = rows.get(j);
                    if (seen.add(unordered(rowA.getKey(), rowB.getKey()))) {
                        pairs.add(new RecordPair<>(rowA, rowB));
                    }
                }
            }
        }
        log.debug("pairs.generated mode=deduplicate buckets={} pairs={}", indexed.bucketCount(), pairs.size());
        return pairs;
    }

    private static <K extends Comparable<K>> List<K> unordered(K a, K b) {
        return a.compareTo(b) <= 0 ? List.of(a, b) : List.of(b, a);
    }
}
