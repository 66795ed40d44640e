package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Key;
import com.danieljhkim.distkv.kvcommon.model.Value;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueMessageRequest extends KvRequest<EnqueueMessageRequest> {

    private Key inbox;
    private Value message;

    @Override
    protected EnqueueMessageRequest copy() {
        return new EnqueueMessageRequest(inbox, message);
    }
}
