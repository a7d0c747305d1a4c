package com.phylotree.service;

import java.util.List;

/**
 * Outcome of a successful write.
 *
 * @param cladeCount      clade elements written, one per tree node
 * @param emittedColumns  ledger contents at the end of the write, in the order they were recorded
 */
public record WriteSummary(int cladeCount, List<String> emittedColumns) {

    public WriteSummary {
        emittedColumns = List.copyOf(emittedColumns);
    }
}
