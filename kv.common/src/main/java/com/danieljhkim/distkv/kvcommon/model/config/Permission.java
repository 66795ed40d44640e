package com.danieljhkim.distkv.kvcommon.model.config;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Read/write grant for a set of users. The empty user name matches everyone.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Permission {

    private List<String> users;
    private boolean read;
    private boolean write;
    private double priority;
}
