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
public class ContainsRequest extends KvRequest<ContainsRequest> {

    private Key key;

    @Override
    protected ContainsRequest copy() {
        return new ContainsRequest(key);
    }
}
