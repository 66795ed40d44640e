package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Key;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DeleteRequest extends KvRequest<DeleteRequest> {

    private Key key;

    @Override
    protected DeleteRequest copy() {
        return new DeleteRequest(key);
    }
}
