package com.phylotree.service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names of the columns already written during one document write.
 * A recorded column is never written again as a generic property. Names are only ever added.
 */
public class EmissionLedger {

    private final Set<String> names = new LinkedHashSet<>();

    public static EmissionLedger seededWith(Collection<String> ignoredColumns) {
        EmissionLedger ledger = new EmissionLedger();
        ignoredColumns.forEach(ledger::record);
        return ledger;
    }

    /**
     * @return true if the name was not recorded before
     */
    public boolean record(String columnName) {
        return names.add(columnName);
    }

    public boolean contains(String columnName) {
        return names.contains(columnName);
    }

    public int size() {
        return names.size();
    }

    public List<String> names() {
        return List.copyOf(names);
    }
}
