package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Key;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Adds {@code increment} to the integer stored at the key, creating it at zero
 * when absent.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class IncrementRequest extends KvRequest<IncrementRequest> {

    private Key key;
    private long increment;

    @Override
    protected IncrementRequest copy() {
        return new IncrementRequest(key, increment);
    }
}
