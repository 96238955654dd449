package org.paycron.services.jobs;

import java.util.Objects;
import java.util.Optional;

/**
 * One configured recurring payment, as read from the configuration file.
 *
 * @param name             display name, may be null
 * @param cronExpression   six or seven field cron expression (seconds first, optional year last)
 * @param amountSats       amount to pay in satoshis
 * @param lnAddressOrLnurl lightning address ({@code user@domain}) or bech32 LNURL
 * @param maxFeeSats       fee ceiling in satoshis, null to use the fallback percentage
 * @param memo             comment sent to the payee, may be null
 */
public record JobDefinition(
        String name,
        String cronExpression,
        long amountSats,
        String lnAddressOrLnurl,
        Long maxFeeSats,
        String memo
) {
    public JobDefinition {
        Objects.requireNonNull(cronExpression, "cronExpression");
        Objects.requireNonNull(lnAddressOrLnurl, "lnAddressOrLnurl");
    }

    public Optional<Long> maxFee() {
        return Optional.ofNullable(maxFeeSats);
    }

    public String memoOrEmpty() {
        return memo != null ? memo : "";
    }

    /** Name used in log lines; falls back to the destination when unnamed. */
    public String displayName() {
        return name != null && !name.isBlank() ? name : lnAddressOrLnurl;
    }
}
