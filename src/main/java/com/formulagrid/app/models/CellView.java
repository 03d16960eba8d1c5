package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Read-only snapshot of a cell as returned to callers, e.g.
 * { "address": "B1", "value": 36, "formula": "=A1+A2+A3" }.
 * Literal and unset cells have no formula.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellView {
    private final String address;
    private final long value;
    private final String formula;

    public CellView(String address, long value, String formula) {
        this.address = address;
        this.value = value;
        this.formula = formula;
    }

    public String getAddress() {
        return address;
    }

    public long getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }
}
