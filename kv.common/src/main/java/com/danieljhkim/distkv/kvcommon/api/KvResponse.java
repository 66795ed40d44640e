package com.danieljhkim.distkv.kvcommon.api;

import lombok.Getter;
import lombok.Setter;

/**
 * Base class of every operation response. A response either carries its
 * operation's result or has its error slot populated.
 */
@Getter
@Setter
public abstract class KvResponse {

    private ResponseError error;

    public boolean hasError() {
        return error != null;
    }
}
