package org.iscc.omero.fingerprint;

import org.apache.commons.codec.binary.Base32;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.Blake3;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 64-bit ISCC Instance-Code: BLAKE3 digest of the raw bytes behind an ISCC header
 * (MainType INSTANCE, SubType NONE, Version 0), base32 encoded with the {@code ISCC:} prefix.
 * <p>
 * The finished hasher also reports the 256-bit Instance-Code, the BLAKE3 multihash and the
 * byte count as units.
 */
public final class IsccInstanceHasher implements StreamingHasher {

    public static final String VERSION = "ISCC-INSTANCE-V0-64";

    public static final String UNIT_INSTANCE = "iscc:inst";
    public static final String UNIT_DATAHASH = "iscc:datahash";
    public static final String UNIT_FILESIZE = "iscc:filesize";

    private static final byte[] HEADER_64 = {0x40, 0x01};
    private static final byte[] HEADER_256 = {0x40, 0x07};
    private static final String MULTIHASH_PREFIX = "1e20";
    private static final int BODY_BYTES = 8;
    private static final int DIGEST_BYTES = 32;

    private final Blake3 blake3 = Blake3.initHash();
    private long size;
    private boolean finished;
    private Map<String, String> units = Map.of();

    @Override
    public void update(byte[] data, int offset, int length) {
        if (finished) {
            throw new IllegalStateException("Hasher already finished");
        }
        blake3.update(data, offset, length);
        size += length;
    }

    @Override
    public String finish() {
        if (finished) {
            throw new IllegalStateException("Hasher already finished");
        }
        finished = true;

        // BLAKE3 output is extendable: the 64-bit body is a prefix of the full digest
        byte[] digest = new byte[DIGEST_BYTES];
        blake3.doFinalize(digest);

        Map<String, String> derived = new LinkedHashMap<>();
        derived.put(UNIT_INSTANCE, encode(HEADER_256, digest, DIGEST_BYTES));
        derived.put(UNIT_DATAHASH, MULTIHASH_PREFIX + Hex.encodeHexString(digest));
        derived.put(UNIT_FILESIZE, Long.toString(size));
        units = Map.copyOf(derived);

        return encode(HEADER_64, digest, BODY_BYTES);
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public Map<String, String> units() {
        if (!finished) {
            throw new IllegalStateException("Hasher not finished");
        }
        return units;
    }

    private static String encode(byte[] header, byte[] digest, int bodyBytes) {
        byte[] code = new byte[header.length + bodyBytes];
        System.arraycopy(header, 0, code, 0, header.length);
        System.arraycopy(digest, 0, code, header.length, bodyBytes);
        return "ISCC:" + new Base32().encodeAsString(code).replace("=", "");
    }
}
