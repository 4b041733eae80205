package com.heroespath.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryStats {
    private long total;
    private long saved;
    private long dismissed;
    private long pending;
}
