package com.danieljhkim.distkv.kvcommon.api;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class AccumulateTSResponse extends KvResponse {
}
