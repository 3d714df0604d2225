package com.cellgraph.app.controllers;

import com.cellgraph.app.models.CellAddress;
import com.cellgraph.app.models.CellView;
import com.cellgraph.app.models.CreateSheetRequest;
import com.cellgraph.app.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Body: { "rows": 100, "columns": 26, "cells": { "A1": "5", "B1": "=A1*2" } }
     * Every field is optional. Returns the new sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) CreateSheetRequest request) {
        CreateSheetRequest body = request == null ? new CreateSheetRequest() : request;
        long sheetId = sheetService.createSheet(
                body.getRows() != null ? body.getRows() : sheetService.defaultRows(),
                body.getColumns() != null ? body.getColumns() : sheetService.defaultColumns(),
                body.getCells());
        return ResponseEntity.ok(sheetId);
    }

    /**
     * DELETE /sheet/{sheetId}
     * Ends the sheet's session and drops its state.
     */
    @DeleteMapping("/{sheetId}")
    public ResponseEntity<Void> deleteSheet(@PathVariable long sheetId) {
        sheetService.deleteSheet(sheetId);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /sheet/{sheetId}/cell/{address}
     * Body: raw input ("42", "hello", "=SUM(A1:A3)").
     * On success: 200 OK.
     * A bad formula or a circular reference is turned into a 400 by the GlobalExceptionHandler.
     */
    @PutMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<Void> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody(required = false) String rawValue
    ) {
        sheetService.setCellValue(sheetId, address, rawValue);
        return ResponseEntity.ok().build();
    }

    /**
     * DELETE /sheet/{sheetId}/cell/{address}
     * Clears the cell (undoable like any other edit).
     */
    @DeleteMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<Void> clearCell(@PathVariable long sheetId, @PathVariable String address) {
        sheetService.clearCell(sheetId, address);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/{sheetId}/cell/{address}
     * Returns { "address", "type", "value", "formula", "error" } for one cell.
     */
    @GetMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<CellView> getCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, address));
    }

    /**
     * GET /sheet/{sheetId}?from=A1&to=C3
     * Returns displayed values of populated cells, in the format: { "A1": "5", "B1": "15", ... }.
     * Without from/to, the whole sheet.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, String>> getSheet(
            @PathVariable long sheetId,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to
    ) {
        if (from != null && to != null) {
            return ResponseEntity.ok(sheetService.getRangeData(sheetId, from, to));
        }
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * POST /sheet/{sheetId}/undo
     * Returns false if there was nothing to undo.
     */
    @PostMapping("/{sheetId}/undo")
    public ResponseEntity<Boolean> undo(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.undo(sheetId));
    }

    /**
     * POST /sheet/{sheetId}/redo
     */
    @PostMapping("/{sheetId}/redo")
    public ResponseEntity<Boolean> redo(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.redo(sheetId));
    }

    /**
     * POST /sheet/{sheetId}/copy?from=C1&to=D5
     * Copies one cell onto another, shifting relative references.
     */
    @PostMapping("/{sheetId}/copy")
    public ResponseEntity<Void> copyCell(
            @PathVariable long sheetId,
            @RequestParam String from,
            @RequestParam String to
    ) {
        sheetService.copyCell(sheetId, from, to);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/{sheetId}/search?text=foo&from=B2
     * Returns the address of the next matching cell, or 404 if none.
     */
    @GetMapping("/{sheetId}/search")
    public ResponseEntity<String> search(
            @PathVariable long sheetId,
            @RequestParam String text,
            @RequestParam(required = false) String from
    ) {
        CellAddress start = from == null ? null : CellAddress.fromString(from);
        Optional<CellAddress> found = sheetService.search(sheetId, text, start);
        return found.map(address -> ResponseEntity.ok(address.toString()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * Returns the forward dependency graph of the sheet,
     * i.e., for each formula cell => the set of cells it references.
     * A range appears once, as "A1:C3".
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * Returns the reverse dependency graph of the sheet,
     * i.e., for each cell or range ("A1:C3") => the set of formula cells that reference it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }
}
