package com.cellgraph.app.models;

/**
 * Read-only snapshot of one cell, returned by the API and serialized as JSON:
 * { "address": "B1", "type": "NUMBER", "value": "15", "formula": "A1+A2", "error": null }
 */
public class CellView {
    private final String address;
    private final ValueType type;
    private final String value;
    private final String formula;
    private final ErrorKind error;

    public CellView(CellAddress address, CellValue value, String formula) {
        this.address = address.toString();
        this.type = value.getType();
        this.value = value.display();
        this.formula = formula;
        this.error = value.isError() ? value.getError() : null;
    }

    public String getAddress() {
        return address;
    }

    public ValueType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }

    public ErrorKind getError() {
        return error;
    }
}
