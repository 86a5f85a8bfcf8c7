package com.nosota.traitmarket.ledger;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Base58Test {

    @Test
    void encode_knownText() {
        assertThat(Base58.encode("Hello World!".getBytes(StandardCharsets.US_ASCII))).isEqualTo("2NEpo7TZRRrLZSi2U");
    }

    @Test
    void encode_allZeroKey_isSystemProgramAddress() {
        assertThat(Base58.encode(new byte[32])).isEqualTo(NativeTransferInstruction.SYSTEM_PROGRAM_ID);
    }

    @Test
    void leadingZeroBytes_areKept() {
        assertThat(Base58.encode(new byte[]{0, 0, 1})).isEqualTo("112");
        assertThat(Base58.decode("112")).containsExactly(0, 0, 1);
    }

    @Test
    void decode_knownText() {
        assertThat(new String(Base58.decode("2NEpo7TZRRrLZSi2U"), StandardCharsets.US_ASCII)).isEqualTo("Hello World!");
    }

    @Test
    void decode_highBitValue_hasNoSignByte() {
        assertThat(Base58.decode(Base58.encode(new byte[]{(byte) 0xff, 0x01}))).containsExactly(0xff, 0x01);
    }

    @Test
    void decode_characterOutsideAlphabet_isRejected() {
        assertThatThrownBy(() -> Base58.decode("0OIl"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'0'");
    }

    @Test
    void emptyInput() {
        assertThat(Base58.encode(new byte[0])).isEmpty();
        assertThat(Base58.decode("")).isEmpty();
    }
}
