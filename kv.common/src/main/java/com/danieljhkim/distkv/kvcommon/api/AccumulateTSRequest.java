package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Key;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Adds {@code counts} element-wise to the time series slot stored at the key.
 * For example a key may hold one minute of data as sixty per-second counts.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AccumulateTSRequest extends KvRequest<AccumulateTSRequest> {

    private Key key;
    private List<Long> counts;

    @Override
    protected AccumulateTSRequest copy() {
        return new AccumulateTSRequest(key, counts);
    }
}
