package io.mockchain.core.state;

import io.mockchain.core.protocol.Block;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Rebuilds balances from scratch by folding every committed block, and compares the result
 * with an incrementally maintained store.
 */
public final class StateReplayer {
    private static final Logger LOG = Logger.getLogger(StateReplayer.class.getName());

    private StateReplayer(){}

    public static StateStore replay(Iterable<Block> chain, long blockReward) {
        StateStore state = new InMemoryStateStore();
        for (Block block : chain) {
            state.applyBlock(block, block.isGenesis() ? 0L : blockReward);
        }
        return state;
    }

    /**
     * Empty string when {@code live} equals the replay and the supply invariant holds,
     * otherwise a description of the first differences found.
     */
    public static String diff(StateStore live, StateStore replayed) {
        StringBuilder sb = new StringBuilder();
        Map<String, Long> a = live.balances();
        Map<String, Long> b = replayed.balances();
        if (!a.equals(b)) {
            int shown = 0;
            for (String address : union(a, b)) {
                long x = a.getOrDefault(address, 0L);
                long y = b.getOrDefault(address, 0L);
                if (x != y && shown++ < 5) {
                    sb.append(address).append(": live=").append(x).append(" replay=").append(y).append("; ");
                }
            }
        }
        if (live.totalSupply() != replayed.totalSupply()) {
            sb.append("supply: live=").append(live.totalSupply()).append(" replay=").append(replayed.totalSupply()).append("; ");
        }
        long sum = 0L;
        for (long v : a.values()) {
            sum = Math.addExact(sum, v);
        }
        if (sum != live.totalSupply()) {
            sb.append("sum of balances ").append(sum).append(" != minted ").append(live.totalSupply()).append("; ");
        }
        if (sb.length() > 0) {
            LOG.warning("Balance audit mismatch: " + sb);
        }
        return sb.toString();
    }

    private static Set<String> union(Map<String, Long> a, Map<String, Long> b) {
        Set<String> keys = new TreeSet<>(a.keySet());
        keys.addAll(b.keySet());
        return keys;
    }
}
