package com.danieljhkim.distkv.kvcommon.model.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Accounting configuration for a key prefix. Carries no settings yet.
 */
@Getter
@Setter
@NoArgsConstructor
public class AcctConfig {

    private String clusterId;
}
