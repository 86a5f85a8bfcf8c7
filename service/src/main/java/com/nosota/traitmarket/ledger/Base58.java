package com.nosota.traitmarket.ledger;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Base58 (Bitcoin alphabet) codec used for ledger addresses and signatures.
 */
public final class Base58 {

    private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final BigInteger BASE = BigInteger.valueOf(58);

    private Base58() {
    }

    public static String encode(byte[] input) {
        if (input.length == 0) {
            return "";
        }
        StringBuilder result = new StringBuilder();
        BigInteger value = new BigInteger(1, input);
        while (value.signum() > 0) {
            BigInteger[] divRem = value.divideAndRemainder(BASE);
            result.append(ALPHABET.charAt(divRem[1].intValue()));
            value = divRem[0];
        }
        // Leading zero bytes are written as '1'
        for (int i = 0; i < input.length && input[i] == 0; i++) {
            result.append(ALPHABET.charAt(0));
        }
        return result.reverse().toString();
    }

    public static byte[] decode(String input) {
        if (input.isEmpty()) {
            return new byte[0];
        }
        BigInteger value = BigInteger.ZERO;
        for (char c : input.toCharArray()) {
            int digit = ALPHABET.indexOf(c);
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid base58 character '" + c + "'");
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }
        byte[] magnitude = value.toByteArray();
        // Drop the sign byte BigInteger adds for values with the top bit set
        if (magnitude.length > 1 && magnitude[0] == 0) {
            magnitude = Arrays.copyOfRange(magnitude, 1, magnitude.length);
        }
        if (value.signum() == 0) {
            magnitude = new byte[0];
        }
        int leadingZeros = 0;
        while (leadingZeros < input.length() && input.charAt(leadingZeros) == ALPHABET.charAt(0)) {
            leadingZeros++;
        }
        byte[] result = new byte[leadingZeros + magnitude.length];
        System.arraycopy(magnitude, 0, result, leadingZeros, magnitude.length);
        return result;
    }
}
