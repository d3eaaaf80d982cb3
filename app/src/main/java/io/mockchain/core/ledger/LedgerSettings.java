package io.mockchain.core.ledger;

import io.mockchain.core.protocol.ProtocolLimits;

/**
 * @param blockReward          minted to the miner of every appended block
 * @param maxPendingTransactions pool capacity
 * @param balanceAuditInterval  appends between full-replay balance audits, 0 disables them
 */
public record LedgerSettings(long blockReward, int maxPendingTransactions, int balanceAuditInterval) {

    public LedgerSettings {
        if (blockReward < 0) throw new IllegalArgumentException("blockReward must be >= 0");
        if (maxPendingTransactions <= 0) throw new IllegalArgumentException("maxPendingTransactions must be > 0");
        if (balanceAuditInterval < 0) throw new IllegalArgumentException("balanceAuditInterval must be >= 0");
    }

    public static LedgerSettings defaults() {
        return new LedgerSettings(ProtocolLimits.DEFAULT_BLOCK_REWARD, 10_000, 100);
    }
}
