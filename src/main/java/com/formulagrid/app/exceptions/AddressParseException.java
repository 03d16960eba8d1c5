package com.formulagrid.app.exceptions;

/**
 * Thrown when a textual cell address does not match [A-Z]+[0-9]+
 * or encodes a coordinate outside the supported range.
 */
public class AddressParseException extends SheetException {

    private final String address;

    public AddressParseException(String address, String reason) {
        super(ErrorCode.INVALID_ADDRESS, "Invalid cell address '" + address + "': " + reason);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
