package com.cellgraph.app.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of POST /sheet:
 * { "rows": 100, "columns": 26, "cells": { "A1": "5", "B1": "=A1*2" } }
 * Missing dimensions fall back to the configured defaults.
 */
public class CreateSheetRequest {
    private Integer rows;
    private Integer columns;
    // raw cell input keyed by address, applied in order without history
    private Map<String, String> cells = new LinkedHashMap<>();

    // Default constructor needed for JSON (de)serialization
    public CreateSheetRequest() {
    }

    public Integer getRows() {
        return rows;
    }
    public Integer getColumns() {
        return columns;
    }
    public Map<String, String> getCells() {
        return cells;
    }
    public void setRows(Integer rows) {
        this.rows = rows;
    }
    public void setColumns(Integer columns) {
        this.columns = columns;
    }
    public void setCells(Map<String, String> cells) {
        this.cells = cells == null ? new LinkedHashMap<>() : cells;
    }
}
