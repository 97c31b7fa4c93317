package io.fairway.platform.usage;

import java.math.BigDecimal;
import java.util.List;

public record OverageSummary(List<OverageCharge> charges, BigDecimal total, String currency) {

  public boolean hasOverage() {
    return total.signum() > 0;
  }
}
