package org.paycron.lnurl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.paycron.exceptions.DecodeException;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DestinationResolverTest {

    private final DestinationResolver resolver = new DestinationResolver();

    @ParameterizedTest
    @CsvSource({
            "alice@example.com, https://example.com/.well-known/lnurlp/alice",
            "nick@domain.com, https://domain.com/.well-known/lnurlp/nick",
            "tips@pay.sub.example.org, https://pay.sub.example.org/.well-known/lnurlp/tips"
    })
    void mapsLightningAddressToWellKnownPath(String address, String expected) throws Exception {
        assertThat(resolver.resolve(address)).isEqualTo(expected);
    }

    @Test
    void decodesLnurlInEitherCase() throws Exception {
        String url = "https://service.com/api?q=3fc3645b439ce8e7f2553a69e5267081";
        String lnurl = Bech32.encode("lnurl", url.getBytes(StandardCharsets.UTF_8));

        assertThat(resolver.resolve(lnurl)).isEqualTo(url);
        assertThat(resolver.resolve(lnurl.toUpperCase(Locale.ROOT))).isEqualTo(url);
    }

    @Test
    void rejectsPayloadThatIsNotUtf8() {
        String lnurl = Bech32.encode("lnurl", new byte[]{(byte) 0xff, (byte) 0xfe, (byte) 0xfd});

        assertThatThrownBy(() -> resolver.resolve(lnurl))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("UTF-8");
    }

    @ParameterizedTest
    @ValueSource(strings = {"not-a-valid-lnurl", "lnurl1invalid", "@example.com", "alice@", " "})
    void rejectsGarbageWithDecodeException(String address) {
        assertThatThrownBy(() -> resolver.resolve(address)).isInstanceOf(DecodeException.class);
    }
}
