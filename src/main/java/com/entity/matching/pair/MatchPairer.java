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
 * Pairs rows of two tables: for every bucket key found in both tables, each row of
 * the left bucket is paired with each row of the right bucket.
 */
public class MatchPairer<K extends Comparable<K>> implements Pairer<K> {
    private static final Logger log = LoggerFactory.getLogger(MatchPairer.class);

    private final Table<K> tableA;
    private final Table<K> tableB;
    private final BlockingIndex index;

    /**
     * @throws StructuralException if either table has duplicated keys or their fields differ
     */
    public MatchPairer(Table<K> tableA, Table<K> tableB, BlockingIndex index) {
        if (!tableA.hasUniqueKeys() || !tableB.hasUniqueKeys()) {
            throw new StructuralException(
                    "Table keys contain duplicates. Both tables need to have keys free of duplicates.");
        }
        if (!new HashSet<>(tableA.fields()).equals(new HashSet<>(tableB.fields()))) {
            throw new StructuralException("Table fields are not equal: "
                    + tableA.fields() + " vs " + tableB.fields());
        }
        this.tableA = tableA;
        this.tableB = tableB;
        this.index = index;
    }

    @Override
    public Table<K> frameA() {
        return tableA;
    }

    @Override
    public Table<K> frameB() {
        return tableB;
    }

    @Override
    public List<RecordPair<K>> pairs() {
        IndexedTable<K> indexedA = index.index(tableA);
        IndexedTable<K> indexedB = index.index(tableB);

        List<RecordPair<K>> pairs = new ArrayList<>();
        Set<List<K>> seen = new HashSet<>();
        int sharedBuckets = 0;
        for (BucketKey key : indexedA.keys()) {
            if (!indexedB.keys().contains(key)) {
                continue;
            }
            sharedBuckets++;
            List<Row<K>> rowsA = indexedA.bucket(key).rows();
            List<Row<K>> rowsB = indexedB.bucket(key).rows();
            for (Row<K> rowA : rowsA) {
                for (Row<K> rowB : rowsB) {
                    if (seen.add(List.of(rowA.getKey(), rowB.getKey()))) {
                        pairs.add(new RecordPair<>(rowA, rowB));
                    }
                }
            }
        }
        log.debug("pairs.generated mode=match bucketsA={} bucketsB={} shared={} pairs={}",
                indexedA.bucketCount(), indexedB.bucketCount(), sharedBuckets, pairs.size());
        return pairs;
    }
}
