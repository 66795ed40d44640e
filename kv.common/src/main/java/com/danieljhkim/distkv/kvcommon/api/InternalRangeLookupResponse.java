package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Key;
import com.danieljhkim.distkv.kvcommon.model.RangeLocations;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The metadata entry found for a lookup. Entries are stored under
 * {@code prefix + endKey} and usually carry only their start key, so
 * {@code metadataKey} is what bounds the range from above.
 */
@Getter
@Setter
@NoArgsConstructor
public class InternalRangeLookupResponse extends KvResponse {

    private RangeLocations locations;
    private Key metadataKey;
}
