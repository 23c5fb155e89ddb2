package org.nostrpool.pool;

import org.nostrpool.relay.RelayUrl;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of reconciling with one relay. An aborted session still carries
 * whatever difference was found before it stopped.
 */
public final class ReconciliationResult {

    private final RelayUrl relayUrl;
    private final Set<String> needIds;
    private final Set<String> haveIds;
    private final boolean complete;
    private final String abortReason;
    private final int rounds;

    ReconciliationResult(RelayUrl relayUrl, Set<String> needIds, Set<String> haveIds,
                         boolean complete, String abortReason, int rounds) {
        this.relayUrl = relayUrl;
        this.needIds = Collections.unmodifiableSet(new LinkedHashSet<>(needIds));
        this.haveIds = Collections.unmodifiableSet(new LinkedHashSet<>(haveIds));
        this.complete = complete;
        this.abortReason = abortReason;
        this.rounds = rounds;
    }

    public RelayUrl getRelayUrl() {
        return relayUrl;
    }

    /** Ids the relay has and the local store lacks. */
    public Set<String> getNeedIds() {
        return needIds;
    }

    /** Ids the local store has and the relay lacks; empty unless the direction uploads. */
    public Set<String> getHaveIds() {
        return haveIds;
    }

    public boolean isComplete() {
        return complete;
    }

    /** Why the session stopped early, or null if complete. */
    public String getAbortReason() {
        return abortReason;
    }

    /** Relay replies processed. */
    public int getRounds() {
        return rounds;
    }

    @Override
    public String toString() {
        return "ReconciliationResult{relay=" + relayUrl + ", need=" + needIds.size() + ", have=" + haveIds.size()
                + (complete ? ", complete" : ", aborted: " + abortReason) + ", rounds=" + rounds + '}';
    }
}
