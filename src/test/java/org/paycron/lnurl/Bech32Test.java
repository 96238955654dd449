package org.paycron.lnurl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.paycron.exceptions.DecodeException;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Bech32Test {

    @Test
    void decodesBip173ValidStrings() throws Exception {
        assertThat(Bech32.decode("A12UEL5L").hrp()).isEqualTo("a");
        assertThat(Bech32.decode("A12UEL5L").data()).isEmpty();

        Bech32.Decoded decoded = Bech32.decode("abcdef1qpzry9x8gf2tvdw0s3jn54khce6mua7lmqqqxw");
        assertThat(decoded.hrp()).isEqualTo("abcdef");
        // 32 five-bit groups are exactly 20 bytes
        assertThat(decoded.data()).hasSize(20);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "pzry9x0s0muk",   // no separator
            "1pzry9x0s0muk",  // empty human readable part
            "x1b4n0q5v",      // 'b' is not in the alphabet
            "li1dgmt3",       // checksum too short
            "a12UEL5L",       // mixed case
            ""
    })
    void rejectsInvalidStrings(String input) {
        assertThatThrownBy(() -> Bech32.decode(input)).isInstanceOf(DecodeException.class);
    }

    @Test
    void acceptsPayloadsLongerThanSegwitLimit() throws Exception {
        String url = "https://service.example.com/api/lnurl/pay?q=3fc3645b439ce8e7f2553a69e5267081d96dcd340693afabe04be7b0ccd178df";
        String encoded = Bech32.encode("lnurl", url.getBytes(StandardCharsets.UTF_8));

        assertThat(encoded.length()).isGreaterThan(90);
        assertThat(new String(Bech32.decode(encoded).data(), StandardCharsets.UTF_8)).isEqualTo(url);
    }

    @Test
    void rejectsCorruptedChecksum() {
        String encoded = Bech32.encode("lnurl", "https://example.com".getBytes(StandardCharsets.UTF_8));
        char last = encoded.charAt(encoded.length() - 1);
        String corrupted = encoded.substring(0, encoded.length() - 1) + (last == 'q' ? 'p' : 'q');

        assertThatThrownBy(() -> Bech32.decode(corrupted))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("checksum");
    }
}
