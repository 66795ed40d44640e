package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Value;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Holds the value read, or an empty value when the key does not exist.
 */
@Getter
@Setter
@NoArgsConstructor
public class GetResponse extends KvResponse {

    private Value value;
}
