package com.danieljhkim.distkv.kvcommon.api;

import com.danieljhkim.distkv.kvcommon.model.Value;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Reaped messages. Fewer than the requested maximum means the inbox is now empty.
 */
@Getter
@Setter
@NoArgsConstructor
public class ReapQueueResponse extends KvResponse {

    private List<Value> messages;
}
