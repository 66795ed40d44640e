package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Key;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Scans and deletes up to {@code maxResults} messages from an inbox. Must run
 * inside a transaction.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ReapQueueRequest extends KvRequest<ReapQueueRequest> {

    private Key inbox;
    private long maxResults;

    @Override
    protected ReapQueueRequest copy() {
        return new ReapQueueRequest(inbox, maxResults);
    }
}
