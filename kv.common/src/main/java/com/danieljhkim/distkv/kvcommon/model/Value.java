package com.danieljhkim.distkv.kvcommon.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A stored value and the timestamp (nanoseconds since epoch) it was written at.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Value {

    private byte[] bytes;
    private long timestamp;

    @JsonIgnore
    public boolean isEmpty() {
        return bytes == null || bytes.length == 0;
    }
}
