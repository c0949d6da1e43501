package com.aitrader.backend.dto;

import java.time.Instant;
import java.util.List;

public record ReplayChain(Instant generatedAt, List<ReplayStep> chain) {
}
