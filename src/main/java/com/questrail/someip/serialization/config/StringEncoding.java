package com.questrail.someip.serialization.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Character encodings permitted for SOME/IP strings.
 */
public enum StringEncoding {
    UTF_8(StandardCharsets.UTF_8, new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF}, 1),
    UTF_16BE(StandardCharsets.UTF_16BE, new byte[] {(byte) 0xFE, (byte) 0xFF}, 2),
    UTF_16LE(StandardCharsets.UTF_16LE, new byte[] {(byte) 0xFF, (byte) 0xFE}, 2);

    private final Charset charset;
    private final byte[] byteOrderMark;
    private final int codeUnitSize;

    StringEncoding(Charset charset, byte[] byteOrderMark, int codeUnitSize) {
        this.charset = charset;
        this.byteOrderMark = byteOrderMark;
        this.codeUnitSize = codeUnitSize;
    }

    public Charset charset() {
        return charset;
    }

    /** A copy of the byte order mark written ahead of the text. */
    public byte[] byteOrderMark() {
        return byteOrderMark.clone();
    }

    /** Size in bytes of one code unit, which is also the terminator size. */
    public int codeUnitSize() {
        return codeUnitSize;
    }

    public boolean isUtf16() {
        return codeUnitSize == 2;
    }
}
