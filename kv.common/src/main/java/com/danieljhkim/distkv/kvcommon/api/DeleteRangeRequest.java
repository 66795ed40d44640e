package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Key;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Deletes keys in [startKey, endKey). Routed by {@code startKey} only, so the
 * range must not span range boundaries.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DeleteRangeRequest extends KvRequest<DeleteRangeRequest> {

    private Key startKey;
    private Key endKey;
    private long maxEntriesToDelete;

    @Override
    protected DeleteRangeRequest copy() {
        return new DeleteRangeRequest(startKey, endKey, maxEntriesToDelete);
    }
}
