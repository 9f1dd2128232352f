package com.nevis.dossier.model.extraction;

import java.math.BigDecimal;

public record CostItem(
    String description,
    BigDecimal amount
) {}
