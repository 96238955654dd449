package org.paycron.lnurl;

import org.paycron.exceptions.DecodeException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Turns a lightning address or a bech32 LNURL into the LNURL-pay endpoint to fetch.
 * No I/O.
 */
public class DestinationResolver {

    static final String LIGHTNING_ADDRESS_TEMPLATE = "https://%s/.well-known/lnurlp/%s";

    public String resolve(String lnAddressOrLnurl) throws DecodeException {
        if (lnAddressOrLnurl == null || lnAddressOrLnurl.isBlank()) {
            throw new DecodeException("Empty payment address");
        }
        String address = lnAddressOrLnurl.trim();

        if (address.contains("@")) {
            int at = address.indexOf('@');
            String localPart = address.substring(0, at);
            String domain = address.substring(at + 1);
            if (localPart.isEmpty() || domain.isEmpty() || domain.contains("@")) {
                throw new DecodeException("Malformed lightning address: " + address);
            }
            return String.format(LIGHTNING_ADDRESS_TEMPLATE, domain, localPart);
        }

        Bech32.Decoded decoded = Bech32.decode(address.toUpperCase(Locale.ROOT));
        return decodeUtf8(decoded.data());
    }

    private static String decodeUtf8(byte[] bytes) throws DecodeException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("LNURL payload is not valid UTF-8", e);
        }
    }
}
