package com.cellgraph.app.services;

import com.cellgraph.app.config.SheetProperties;
import com.cellgraph.app.exceptions.CircularReferenceException;
import com.cellgraph.app.exceptions.InvalidCellAddressException;
import com.cellgraph.app.exceptions.InvalidSheetDimensionsException;
import com.cellgraph.app.exceptions.SheetNotFoundException;
import com.cellgraph.app.formula.FormulaFormatter;
import com.cellgraph.app.formula.FormulaParser;
import com.cellgraph.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Main entry point for creating sheets and reading/editing their cells.
 * Every edit (assign, undo, redo, paste) runs under the sheet's write lock from the cycle check
 * to the end of the recompute cascade; every read runs under the read lock and returns a snapshot.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // Same shape as a formula number, so "12" is a number and "12abc" is text
    private static final Pattern NUMBER_PATTERN = Pattern.compile("^-?(\\d+\\.\\d*|\\.\\d+|\\d+)$");

    // All sheets live here in memory; no persistent storage
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final SheetProperties properties;
    private final DependencyGraphMaintainer maintainer;
    private final ReferenceTransformer transformer;

    @Autowired
    public SheetService(SheetProperties properties,
                        DependencyGraphMaintainer maintainer,
                        ReferenceTransformer transformer) {
        this.properties = properties;
        this.maintainer = maintainer;
        this.transformer = transformer;
    }

    /**
     * Standalone wiring with default settings, blocking SLEEP.
     */
    public SheetService() {
        this(new SheetProperties(),
                new DependencyGraphMaintainer(new FormulaEvaluator(new ThreadSleeper())),
                new ReferenceTransformer());
    }

    // ----------------------------------------------------------------
    // Sheet lifecycle
    // ----------------------------------------------------------------

    public long createSheet() {
        return createSheet(defaultRows(), defaultColumns());
    }

    public int defaultRows() {
        return properties.getDefaultRows();
    }

    public int defaultColumns() {
        return properties.getDefaultColumns();
    }

    /**
     * Creates a new empty sheet with the given bounds and returns its ID.
     */
    public long createSheet(int rows, int columns) {
        return createSheet(rows, columns, Collections.emptyMap());
    }

    /**
     * Creates a sheet pre-filled with raw inputs. The initial contents are not undoable.
     * If any input is malformed or the inputs form a cycle, nothing is registered.
     */
    public long createSheet(int rows, int columns, Map<String, String> initialCells) {
        if (rows < 1 || columns < 1 || rows > properties.getMaxRows() || columns > properties.getMaxColumns()) {
            throw new InvalidSheetDimensionsException("Sheet must be between 1x1 and "
                    + properties.getMaxRows() + "x" + properties.getMaxColumns() + ", got " + rows + "x" + columns);
        }
        Sheet sheet = new Sheet(rows, columns, properties.getHistoryMaxEntries());
        for (Map.Entry<String, String> entry : initialCells.entrySet()) {
            CellAddress address = requireInBounds(sheet, CellAddress.fromString(entry.getKey()));
            maintainer.assign(sheet, address, parseInput(address, entry.getValue()));
        }
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {} ({}x{}, {} initial cells)", sheet.getId(), rows, columns, initialCells.size());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    public void deleteSheet(long sheetId) {
        if (sheets.remove(sheetId) == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        log.info("Deleted sheet {}", sheetId);
    }

    // ----------------------------------------------------------------
    // Edits
    // ----------------------------------------------------------------

    /**
     * Sets a cell from user input: "=..." is a formula, a number is a number,
     * blank clears the cell, anything else is text.
     * Formula text is parsed before the sheet is locked, so a parse error changes nothing.
     */
    public void setCellValue(long sheetId, String address, String rawValue) {
        CellAddress cell = CellAddress.fromString(address);
        assign(sheetId, cell, parseInput(cell, rawValue));
    }

    public void clearCell(long sheetId, String address) {
        assign(sheetId, CellAddress.fromString(address), CellData.EMPTY);
    }

    /**
     * Replaces a cell's content and recomputes everything downstream of it.
     * Throws CircularReferenceException, leaving the sheet untouched, if the edit would create a loop.
     */
    public void assign(long sheetId, CellAddress address, CellData data) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().writeLock().lock();
        try {
            requireInBounds(sheet, address);
            CellData before = sheet.getStore().get(address);
            int recomputed = applyEdit(sheet, address, data);
            sheet.getHistory().commit(new HistoryEntry(address, before, data));
            log.debug("Sheet {}: {} <- {} ({} formulas recomputed)", sheetId, address, data, recomputed);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Reverts the most recent edit, recomputing its dependents.
     * Returns false if there was nothing to undo.
     */
    public boolean undo(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().writeLock().lock();
        try {
            HistoryEntry entry = sheet.getHistory().popUndo();
            if (entry == null) {
                return false;
            }
            replay(sheet, entry, entry.getBefore(), () -> sheet.getHistory().pushUndo(entry));
            sheet.getHistory().pushRedo(entry);
            log.debug("Sheet {}: undid {}", sheetId, entry);
            return true;
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Re-applies the most recently undone edit. Returns false if there was nothing to redo.
     */
    public boolean redo(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().writeLock().lock();
        try {
            HistoryEntry entry = sheet.getHistory().popRedo();
            if (entry == null) {
                return false;
            }
            replay(sheet, entry, entry.getAfter(), () -> sheet.getHistory().pushRedo(entry));
            sheet.getHistory().pushUndo(entry);
            log.debug("Sheet {}: redid {}", sheetId, entry);
            return true;
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Copy / paste
    // ----------------------------------------------------------------

    /**
     * Captures a cell's content together with its address.
     */
    public CopiedCell copy(long sheetId, CellAddress address) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return new CopiedCell(sheet.getStore().get(address), address);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Writes copied content at {@code destination}; relative references in a formula keep
     * their displacement, absolute ones stay put. Goes through the normal assignment path.
     */
    public void paste(long sheetId, CopiedCell copied, CellAddress destination) {
        CellData data = copied.getData();
        if (data.isFormula()) {
            data = CellData.formula(transformer.transformForPaste(data.getFormula(), copied.getHome(), destination));
        }
        assign(sheetId, destination, data);
    }

    public void copyCell(long sheetId, String from, String to) {
        paste(sheetId, copy(sheetId, CellAddress.fromString(from)), CellAddress.fromString(to));
    }

    // ----------------------------------------------------------------
    // Reads
    // ----------------------------------------------------------------

    /**
     * The current value of a cell; EMPTY if it was never written.
     */
    public CellValue get(long sheetId, CellAddress address) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return sheet.getStore().get(address).getValue();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public CellValue get(long sheetId, String address) {
        return get(sheetId, CellAddress.fromString(address));
    }

    public CellData getCellData(long sheetId, CellAddress address) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return sheet.getStore().get(address);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Value, formula text and error kind of one cell.
     */
    public CellView getCell(long sheetId, String address) {
        CellAddress cell = CellAddress.fromString(address);
        CellData data = getCellData(sheetId, cell);
        String formula = data.isFormula() ? FormulaFormatter.format(data.getFormula(), cell) : null;
        return new CellView(cell, data.getValue(), formula);
    }

    /**
     * The formula of a cell as text relative to that cell, or null if it holds no formula.
     */
    public String formulaText(long sheetId, CellAddress address) {
        CellData data = getCellData(sheetId, address);
        return data.isFormula() ? FormulaFormatter.format(data.getFormula(), address) : null;
    }

    /**
     * Populated cells of a rectangle, in row-major order.
     */
    public Map<CellAddress, CellValue> range(long sheetId, CellAddress a, CellAddress b) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Map<CellAddress, CellValue> values = new LinkedHashMap<>();
            for (Map.Entry<CellAddress, CellData> e : sheet.getStore().range(a, b)) {
                values.put(e.getKey(), e.getValue().getValue());
            }
            return values;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Returns a map of address -> displayed value for every populated cell,
     * e.g. { "A1": "5", "B1": "15", "C1": "#DIV/0!" }.
     */
    public Map<String, String> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Map<String, String> data = new LinkedHashMap<>();
            for (Map.Entry<CellAddress, CellData> e : sheet.getStore().after(null)) {
                data.put(e.getKey().toString(), e.getValue().getValue().display());
            }
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public Map<String, String> getRangeData(long sheetId, String from, String to) {
        Map<String, String> data = new LinkedHashMap<>();
        range(sheetId, CellAddress.fromString(from), CellAddress.fromString(to))
                .forEach((address, value) -> data.put(address.toString(), value.display()));
        return data;
    }

    /**
     * First cell after {@code from} (row-major; from the top when null) whose number or text
     * contains {@code text}.
     */
    public Optional<CellAddress> search(long sheetId, String text, CellAddress from) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            for (Map.Entry<CellAddress, CellData> e : sheet.getStore().after(from)) {
                CellValue value = e.getValue().getValue();
                switch (value.getType()) {
                    case NUMBER:
                    case TEXT:
                        if (value.display().contains(text)) {
                            return Optional.of(e.getKey());
                        }
                        break;
                    case ERROR:
                    case EMPTY:
                        break;
                    default:
                        throw new IllegalStateException("Unknown value type " + value.getType());
                }
            }
            return Optional.empty();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public Map<String, Set<String>> getForwardDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return sheet.getDependencies().forwardView();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public Map<String, Set<String>> getReverseDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return sheet.getDependencies().reverseView();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    /**
     * Converts user input to cell content.
     * Throws FormulaParseException if "=..." is not a valid formula.
     */
    CellData parseInput(CellAddress address, String rawValue) {
        if (rawValue == null || rawValue.trim().isEmpty()) {
            return CellData.EMPTY;
        }
        String trimmed = rawValue.trim();
        if (trimmed.startsWith("=")) {
            return CellData.formula(FormulaParser.parse(trimmed.substring(1), address));
        }
        if (NUMBER_PATTERN.matcher(trimmed).matches()) {
            return CellData.literal(CellValue.number(Double.parseDouble(trimmed)));
        }
        return CellData.literal(CellValue.text(rawValue));
    }

    private int applyEdit(Sheet sheet, CellAddress address, CellData data) {
        try {
            return maintainer.assign(sheet, address, data);
        } catch (CircularReferenceException ex) {
            log.warn("Sheet {}: rejected edit of {}: {}", sheet.getId(), address, ex.getMessage());
            throw ex;
        }
    }

    /**
     * Undo/redo re-run the normal assignment so dependents are recomputed; they are not recorded
     * as new edits. History replays states the sheet has already held, so a cycle here means the
     * log is corrupt; the entry is put back before failing.
     */
    private void replay(Sheet sheet, HistoryEntry entry, CellData data, Runnable restoreEntry) {
        try {
            applyEdit(sheet, entry.getAddress(), data);
        } catch (CircularReferenceException ex) {
            restoreEntry.run();
            throw new IllegalStateException("History replay of " + entry.getAddress() + " failed", ex);
        }
    }

    private static CellAddress requireInBounds(Sheet sheet, CellAddress address) {
        if (!sheet.contains(address)) {
            throw new InvalidCellAddressException("Cell " + address + " is outside the "
                    + sheet.getRows() + "x" + sheet.getColumns() + " sheet");
        }
        return address;
    }
}
