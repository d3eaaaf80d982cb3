package io.mockchain.core.node;

import io.mockchain.core.consensus.ConsensusSettings;
import io.mockchain.core.ledger.LedgerSettings;
import io.mockchain.core.protocol.ProtocolLimits;

import java.time.Duration;
import java.util.Objects;

/** Simple config holder for a local node. */
public final class NodeConfig {
    public final ConsensusSettings consensus;
    public final String minerAddress;
    public final long blockReward;
    public final int maxTxPerBlock;
    public final int maxPendingTransactions;
    public final int balanceAuditInterval;
    public final long faucetAmount;
    public final Duration faucetCooldown;
    public final boolean produceEmptyBlocks;
    public final Duration idlePoll;

    private NodeConfig(Builder b) {
        this.consensus = Objects.requireNonNull(b.consensus, "consensus");
        this.minerAddress = (b.minerAddress == null || b.minerAddress.isBlank()) ? null : b.minerAddress;
        this.blockReward = b.blockReward;
        this.maxTxPerBlock = b.maxTxPerBlock;
        this.maxPendingTransactions = b.maxPendingTransactions;
        this.balanceAuditInterval = b.balanceAuditInterval;
        this.faucetAmount = b.faucetAmount;
        this.faucetCooldown = b.faucetCooldown == null ? Duration.ZERO : b.faucetCooldown;
        this.produceEmptyBlocks = b.produceEmptyBlocks;
        this.idlePoll = b.idlePoll == null ? Duration.ofMillis(200) : b.idlePoll;
    }

    public static NodeConfig defaultLocal() {
        return builder().build();
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .consensus(consensus)
                .minerAddress(minerAddress)
                .blockReward(blockReward)
                .maxTxPerBlock(maxTxPerBlock)
                .maxPendingTransactions(maxPendingTransactions)
                .balanceAuditInterval(balanceAuditInterval)
                .faucetAmount(faucetAmount)
                .faucetCooldown(faucetCooldown)
                .produceEmptyBlocks(produceEmptyBlocks)
                .idlePoll(idlePoll);
    }

    public LedgerSettings ledgerSettings() {
        return new LedgerSettings(blockReward, maxPendingTransactions, balanceAuditInterval);
    }

    public ProducerSettings producerSettings() {
        return new ProducerSettings(maxTxPerBlock, produceEmptyBlocks, idlePoll);
    }

    public static final class Builder {
        private ConsensusSettings consensus = ConsensusSettings.proofOfWork(ConsensusSettings.DEFAULT_DIFFICULTY);
        private String minerAddress;                     // generated at startup when absent
        private long blockReward = ProtocolLimits.DEFAULT_BLOCK_REWARD;
        private int maxTxPerBlock = 1000;
        private int maxPendingTransactions = 10_000;
        private int balanceAuditInterval = 100;
        private long faucetAmount = Faucet.DEFAULT_AMOUNT;
        private Duration faucetCooldown = Duration.ZERO; // unlimited
        private boolean produceEmptyBlocks;
        private Duration idlePoll = Duration.ofMillis(200);

        public Builder consensus(ConsensusSettings c) { this.consensus = c; return this; }
        public Builder minerAddress(String a) { this.minerAddress = a; return this; }
        public Builder blockReward(long r) { this.blockReward = r; return this; }
        public Builder maxTxPerBlock(int n) { this.maxTxPerBlock = n; return this; }
        public Builder maxPendingTransactions(int n) { this.maxPendingTransactions = n; return this; }
        public Builder balanceAuditInterval(int n) { this.balanceAuditInterval = n; return this; }
        public Builder faucetAmount(long a) { this.faucetAmount = a; return this; }
        public Builder faucetCooldown(Duration d) { this.faucetCooldown = d; return this; }
        public Builder produceEmptyBlocks(boolean b) { this.produceEmptyBlocks = b; return this; }
        public Builder idlePoll(Duration d) { this.idlePoll = d; return this; }

        public NodeConfig build() {
            return new NodeConfig(this);
        }
    }
}
