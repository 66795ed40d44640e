package com.danieljhkim.distkv.kvcommon.model.config;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Replication and sizing policy for ranges under a key prefix.
 *
 * <p>
 * {@code replicas} maps a datacenter to the device attributes of each replica
 * placed there; the empty datacenter name matches any.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ZoneConfig {

    private Map<String, List<String>> replicas = new HashMap<>();
    private long rangeMinBytes;
    private long rangeMaxBytes;
}
