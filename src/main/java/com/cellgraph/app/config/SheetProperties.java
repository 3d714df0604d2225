package com.cellgraph.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "cellgraph" prefix (see application.properties).
 * Defaults match a 999 x ZZZ sheet.
 */
@ConfigurationProperties(prefix = "cellgraph")
public class SheetProperties {

    private int defaultRows = 999;
    private int defaultColumns = 18278;
    private int maxRows = 999;
    private int maxColumns = 18278;
    // undo steps kept per sheet
    private int historyMaxEntries = 1000;

    public int getDefaultRows() {
        return defaultRows;
    }

    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }

    public int getDefaultColumns() {
        return defaultColumns;
    }

    public void setDefaultColumns(int defaultColumns) {
        this.defaultColumns = defaultColumns;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public void setMaxColumns(int maxColumns) {
        this.maxColumns = maxColumns;
    }

    public int getHistoryMaxEntries() {
        return historyMaxEntries;
    }

    public void setHistoryMaxEntries(int historyMaxEntries) {
        this.historyMaxEntries = historyMaxEntries;
    }
}
