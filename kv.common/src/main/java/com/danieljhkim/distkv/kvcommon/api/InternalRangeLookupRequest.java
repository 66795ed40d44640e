package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Key;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Looks up the metadata entry for the range containing {@code key}, where
 * {@code key} is a level-1 or level-2 metadata key.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class InternalRangeLookupRequest extends KvRequest<InternalRangeLookupRequest> {

    private Key key;

    @Override
    protected InternalRangeLookupRequest copy() {
        return new InternalRangeLookupRequest(key);
    }
}
