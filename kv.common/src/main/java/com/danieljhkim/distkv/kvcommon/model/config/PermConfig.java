package com.danieljhkim.distkv.kvcommon.model.config;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PermConfig {

    private List<Permission> perms = new ArrayList<>();
}
