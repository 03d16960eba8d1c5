package com.formulagrid.app.models;

import com.formulagrid.app.exceptions.AddressParseException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between textual addresses and {@link CellId}s.
 * <p>
 * An address is one or more uppercase letters followed by one or more digits.
 * The letters are a bijective base-26 numeral (A=1 ... Z=26, AA=27) naming the <b>row</b>;
 * the digits are a 1-indexed number naming the <b>column</b>. Both are stored zero-indexed,
 * so "A1" is (0, 0) and "AB32" is row 27, column 31.
 */
public final class CellAddress {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("([A-Z]+)([0-9]+)");
    private static final int BASE = 26;

    private CellAddress() {
    }

    /**
     * Decodes an address, throwing {@link AddressParseException} if it is malformed.
     */
    public static CellId parse(String address) {
        if (address == null) {
            throw new AddressParseException(null, "address is missing");
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(address);
        if (!matcher.matches()) {
            throw new AddressParseException(address, "expected letters followed by digits");
        }
        int row = decodeLetters(address, matcher.group(1));
        int column = decodeDigits(address, matcher.group(2));
        return CellId.of(row, column);
    }

    /**
     * Encodes an id back to its canonical textual address.
     */
    public static String format(CellId id) {
        StringBuilder letters = new StringBuilder();
        long n = id.getRow() + 1L;
        while (n > 0) {
            int digit = (int) ((n - 1) % BASE);
            letters.append((char) ('A' + digit));
            n = (n - 1) / BASE;
        }
        return letters.reverse().toString() + (id.getColumn() + 1);
    }

    /**
     * Decodes a run of A-Z letters as a bijective base-26 number, minus one.
     */
    static int decodeLetters(String address, String letters) {
        int sum = 0;
        try {
            for (int i = 0; i < letters.length(); i++) {
                char ch = letters.charAt(i);
                if (ch < 'A' || ch > 'Z') {
                    throw new AddressParseException(address, "unexpected letter '" + ch + "'");
                }
                sum = Math.addExact(Math.multiplyExact(sum, BASE), ch - 'A' + 1);
            }
        } catch (ArithmeticException e) {
            throw new AddressParseException(address, "row letters out of range");
        }
        return sum - 1;
    }

    private static int decodeDigits(String address, String digits) {
        int number;
        try {
            number = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new AddressParseException(address, "column number out of range");
        }
        if (number < 1) {
            throw new AddressParseException(address, "column numbers start at 1");
        }
        return number - 1;
    }
}
