package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Key;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Commits or aborts a transaction. Routed by the first of {@code keys}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EndTransactionRequest extends KvRequest<EndTransactionRequest> {

    private List<Key> keys;
    private boolean commit;

    @Override
    protected EndTransactionRequest copy() {
        return new EndTransactionRequest(keys, commit);
    }
}
