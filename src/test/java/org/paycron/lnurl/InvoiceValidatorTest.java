package org.paycron.lnurl;

import org.junit.jupiter.api.Test;
import org.paycron.exceptions.MalformedResponseException;
import org.paycron.lnurl.dto.PayInfoResponse;
import org.paycron.services.jobs.JobDefinition;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvoiceValidatorTest {

    private static PayInfoResponse info(Long min, Long max, Integer commentAllowed) {
        return new PayInfoResponse("payRequest", "https://pay.example/cb", min, max, commentAllowed, null, null);
    }

    private static JobDefinition job(long sats, String memo) {
        return new JobDefinition(null, "* * * * * *", sats, "bob@example.com", null, memo);
    }

    @Test
    void permissiveAcceptsAnything() {
        assertThatCode(() -> InvoiceValidator.PERMISSIVE.validate(info(1L, 2L, 0), job(1_000_000, "far too long")))
                .doesNotThrowAnyException();
    }

    @Test
    void sendableRangeComparesInMillisats() {
        InvoiceValidator validator = InvoiceValidator.sendableRange();

        assertThatCode(() -> validator.validate(info(1000L, 10_000L, null), job(10, null)))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validate(info(20_000L, null, null), job(10, null)))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("minSendable");
    }

    @Test
    void sendableRangeChecksCommentLength() {
        InvoiceValidator validator = InvoiceValidator.sendableRange();

        assertThatThrownBy(() -> validator.validate(info(null, null, 5), job(10, "longer than five")))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("allows 5");
        assertThatCode(() -> validator.validate(info(null, null, null), job(10, "no limit advertised")))
                .doesNotThrowAnyException();
    }
}
