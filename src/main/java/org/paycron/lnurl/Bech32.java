package org.paycron.lnurl;

import org.paycron.exceptions.DecodeException;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Locale;

/**
 * Bech32 (BIP-173) codec. Unlike segwit addresses, LNURLs routinely exceed the
 * 90 character limit of BIP-173, so no length limit is enforced.
 */
public final class Bech32 {

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int CHECKSUM_LENGTH = 6;
    private static final int[] GENERATOR = {0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};

    private static final byte[] CHARSET_REV = new byte[128];

    static {
        Arrays.fill(CHARSET_REV, (byte) -1);
        for (int i = 0; i < CHARSET.length(); i++) {
            CHARSET_REV[CHARSET.charAt(i)] = (byte) i;
            CHARSET_REV[Character.toUpperCase(CHARSET.charAt(i))] = (byte) i;
        }
    }

    private Bech32() {}

    /** Human readable part plus the payload regrouped into 8-bit bytes. */
    public record Decoded(String hrp, byte[] data) {}

    public static Decoded decode(String bech) throws DecodeException {
        if (bech == null || bech.isEmpty()) {
            throw new DecodeException("Empty bech32 string");
        }
        boolean lower = false;
        boolean upper = false;
        for (int i = 0; i < bech.length(); i++) {
            char c = bech.charAt(i);
            if (c < 33 || c > 126) {
                throw new DecodeException("Invalid character in bech32 string at position " + i);
            }
            if (c >= 'a' && c <= 'z') lower = true;
            if (c >= 'A' && c <= 'Z') upper = true;
        }
        if (lower && upper) {
            throw new DecodeException("Mixed case bech32 string");
        }

        int separator = bech.lastIndexOf('1');
        if (separator < 1) {
            throw new DecodeException("Missing human readable part in bech32 string");
        }
        if (separator + 1 + CHECKSUM_LENGTH > bech.length()) {
            throw new DecodeException("Bech32 checksum too short");
        }

        String hrp = bech.substring(0, separator).toLowerCase(Locale.ROOT);
        byte[] values = new byte[bech.length() - separator - 1];
        for (int i = 0; i < values.length; i++) {
            char c = bech.charAt(separator + 1 + i);
            byte v = c < 128 ? CHARSET_REV[c] : -1;
            if (v == -1) {
                throw new DecodeException("Invalid bech32 data character '" + c + "'");
            }
            values[i] = v;
        }
        if (!verifyChecksum(hrp, values)) {
            throw new DecodeException("Invalid bech32 checksum");
        }

        byte[] words = Arrays.copyOfRange(values, 0, values.length - CHECKSUM_LENGTH);
        return new Decoded(hrp, convertBits(words, 5, 8, false));
    }

    public static String encode(String hrp, byte[] payload) {
        String lowerHrp = hrp.toLowerCase(Locale.ROOT);
        byte[] words;
        try {
            words = convertBits(payload, 8, 5, true);
        } catch (DecodeException e) {
            // padding is allowed when encoding, so regrouping cannot fail
            throw new IllegalStateException(e);
        }
        byte[] checksum = createChecksum(lowerHrp, words);

        StringBuilder sb = new StringBuilder(lowerHrp.length() + 1 + words.length + checksum.length);
        sb.append(lowerHrp).append('1');
        for (byte w : words) sb.append(CHARSET.charAt(w));
        for (byte w : checksum) sb.append(CHARSET.charAt(w));
        return sb.toString();
    }

    private static int polymod(byte[] values) {
        int chk = 1;
        for (byte v : values) {
            int top = chk >>> 25;
            chk = ((chk & 0x1ffffff) << 5) ^ (v & 0xff);
            for (int i = 0; i < 5; i++) {
                if (((top >>> i) & 1) == 1) chk ^= GENERATOR[i];
            }
        }
        return chk;
    }

    private static byte[] expandHrp(String hrp) {
        int len = hrp.length();
        byte[] out = new byte[len * 2 + 1];
        for (int i = 0; i < len; i++) {
            int c = hrp.charAt(i) & 0x7f;
            out[i] = (byte) ((c >>> 5) & 0x07);
            out[i + len + 1] = (byte) (c & 0x1f);
        }
        out[len] = 0;
        return out;
    }

    private static boolean verifyChecksum(String hrp, byte[] values) {
        byte[] expanded = expandHrp(hrp);
        byte[] combined = new byte[expanded.length + values.length];
        System.arraycopy(expanded, 0, combined, 0, expanded.length);
        System.arraycopy(values, 0, combined, expanded.length, values.length);
        return polymod(combined) == 1;
    }

    private static byte[] createChecksum(String hrp, byte[] values) {
        byte[] expanded = expandHrp(hrp);
        byte[] enc = new byte[expanded.length + values.length + CHECKSUM_LENGTH];
        System.arraycopy(expanded, 0, enc, 0, expanded.length);
        System.arraycopy(values, 0, enc, expanded.length, values.length);
        int mod = polymod(enc) ^ 1;
        byte[] ret = new byte[CHECKSUM_LENGTH];
        for (int i = 0; i < CHECKSUM_LENGTH; i++) {
            ret[i] = (byte) ((mod >>> (5 * (5 - i))) & 31);
        }
        return ret;
    }

    private static byte[] convertBits(byte[] data, int fromBits, int toBits, boolean pad) throws DecodeException {
        int acc = 0;
        int bits = 0;
        int maxv = (1 << toBits) - 1;
        int maxAcc = (1 << (fromBits + toBits - 1)) - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * fromBits / toBits + 1);
        for (byte b : data) {
            int value = b & 0xff;
            if ((value >>> fromBits) != 0) {
                throw new DecodeException("Invalid value for " + fromBits + "-bit group: " + value);
            }
            acc = ((acc << fromBits) | value) & maxAcc;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxv);
            }
        }
        if (pad) {
            if (bits > 0) out.write((acc << (toBits - bits)) & maxv);
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxv) != 0) {
            throw new DecodeException("Invalid padding in bech32 payload");
        }
        return out.toByteArray();
    }
}
