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
public class ScanRequest extends KvRequest<ScanRequest> {

    private Key startKey;
    private Key endKey;
    private long maxResults;

    @Override
    protected ScanRequest copy() {
        return new ScanRequest(startKey, endKey, maxResults);
    }
}
