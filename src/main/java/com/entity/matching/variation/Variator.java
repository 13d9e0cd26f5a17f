package com.entity.matching.variation;

import com.entity.matching.core.model.Row;

import java.util.List;

/**
 * Produces alternate versions of a row. The engine scores every combination of
 * variations of both rows and keeps the highest score, which absorbs systematic
 * data-entry mistakes such as swapped columns.
 *
 * <p>The returned list must contain the original row.</p>
 */
@FunctionalInterface
public interface Variator {

    <K extends Comparable<K>> List<Row<K>> variations(Row<K> row);

    /**
     * Returns the variator that yields the row unchanged.
     */
    static Variator identity() {
        return Identity.INSTANCE;
    }

    final class Identity implements Variator {
        private static final Identity INSTANCE = new Identity();

        private Identity() {
        }

        @Override
        public <K extends Comparable<K>> List<Row<K>> variations(Row<K> row) {
            return List.of(row);
        }
    }
}
