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
public class EnqueueUpdateRequest extends KvRequest<EnqueueUpdateRequest> {

    private Key key;
    private Value update;

    @Override
    protected EnqueueUpdateRequest copy() {
        return new EnqueueUpdateRequest(key, update);
    }
}
