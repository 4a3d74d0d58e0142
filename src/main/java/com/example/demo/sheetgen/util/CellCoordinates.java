package com.example.demo.sheetgen.util;

import com.example.demo.sheetgen.exception.LayoutException;
import com.example.demo.sheetgen.model.CellPosition;
import org.apache.poi.ss.util.CellReference;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between 1-based (row, column) pairs and spreadsheet addresses such as "B3".
 *
 * Columns use the bijective base-26 letter sequence: 1 -> A, 26 -> Z, 27 -> AA,
 * 702 -> ZZ, 703 -> AAA. Addresses are relative and unqualified: "$A$1" and
 * "Sheet1!A1" are rejected.
 */
public final class CellCoordinates {

    /** "ZZZZZZ", the widest column an address of six letters can name. */
    public static final int MAX_COLUMN = 321_272_406;

    private static final Pattern ADDRESS = Pattern.compile("([A-Za-z]{1,6})([1-9][0-9]{0,8})");

    private CellCoordinates() {
    }

    /**
     * @param row    1-based row number
     * @param column 1-based column number
     * @return the address, e.g. encode(3, 2) = "B3"
     * @throws LayoutException INVALID_COORDINATE when row or column is out of range
     */
    public static String encode(int row, int column) {
        if (row < 1 || column < 1 || column > MAX_COLUMN) {
            throw new LayoutException(LayoutException.INVALID_COORDINATE,
                    "Cannot encode row=" + row + ", column=" + column + "; both must be positive");
        }
        return CellReference.convertNumToColString(column - 1) + row;
    }

    /**
     * @param address an address such as "B3" (letters are case-insensitive)
     * @return the 1-based position
     * @throws LayoutException INVALID_COORDINATE when the address is malformed
     */
    public static CellPosition decode(String address) {
        if (address == null) {
            throw new LayoutException(LayoutException.INVALID_COORDINATE, "Cell address is missing");
        }
        Matcher matcher = ADDRESS.matcher(address.trim());
        if (!matcher.matches()) {
            throw new LayoutException(LayoutException.INVALID_COORDINATE, "Malformed cell address '" + address + "'");
        }
        int column = CellReference.convertColStringToIndex(matcher.group(1).toUpperCase(Locale.ROOT)) + 1;
        int row = Integer.parseInt(matcher.group(2));
        return new CellPosition(row, column);
    }

    /**
     * Canonical (upper-case, trimmed) form of an address, e.g. " b3" gives "B3".
     */
    public static String normalize(String address) {
        CellPosition position = decode(address);
        return encode(position.getRow(), position.getColumn());
    }
}
