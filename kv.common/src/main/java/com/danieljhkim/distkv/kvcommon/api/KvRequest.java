package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Replica;
import lombok.Getter;
import lombok.Setter;

/**
 * Base class of every operation request sent to a storage node.
 *
 * <p>
 * A request is addressed to one replica at a time. The router never mutates the
 * caller's request; {@link #withReplica(Replica)} stamps a copy per target so
 * the receiving node can check that it holds the addressed replica.
 *
 * @param <Q>
 *            the concrete request type
 */
@Getter
@Setter
public abstract class KvRequest<Q extends KvRequest<Q>> {

    private Replica replica;
    private long timestamp;

    /**
     * Copies the operation-specific fields into a new request.
     */
    protected abstract Q copy();

    public Q withReplica(Replica replica) {
        Q copy = copy();
        copy.setReplica(replica);
        copy.setTimestamp(timestamp);
        return copy;
    }
}
