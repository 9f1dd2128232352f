package com.nevis.dossier.model.extraction;

import java.math.BigDecimal;

public record UpcomingWork(
    String description,
    BigDecimal cost,
    String timeline,
    String urgency
) {}
