package com.flagship.token_ledger.ledger;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Append-only transfer history.
 *
 * Appends are made by the single ledger writer; reads are lock-free and may
 * run concurrently with an append. Readers ask for a prefix whose length comes
 * from a published {@link LedgerState}, so an entry that is appended but not
 * yet published is never returned.
 */
final class TransferLog {

    private final ConcurrentLinkedQueue<TransferRecord> records = new ConcurrentLinkedQueue<>();

    // Only touched by the writer holding the ledger's mutation lock.
    private long lastSequence;

    TransferRecord append(Principal from, Principal to, BigInteger amount, Instant timestamp) {
        TransferRecord record = new TransferRecord(lastSequence + 1, from, to, amount, timestamp);
        records.add(record);
        lastSequence = record.getSequenceNumber();
        return record;
    }

    List<TransferRecord> prefix(long count) {
        return records.stream()
            .limit(count)
            .toList();
    }
}
