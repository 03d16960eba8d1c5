package com.formulagrid.app.controllers;

import com.formulagrid.app.exceptions.InvalidTypeException;
import com.formulagrid.app.models.CellView;
import com.formulagrid.app.services.SheetService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * REST endpoints for reading and updating the sheet.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    private static final Logger logger = LoggerFactory.getLogger(SheetController.class);

    // A body that is just an integer is stored as a literal; anything else is formula text
    private static final Pattern LITERAL_PATTERN = Pattern.compile("-?[0-9]+");

    @Autowired
    private SheetService sheetService;

    /**
     * PUT /sheet/cells/{address}
     * Body: a literal integer ("42") or a formula ("=A1+B2").
     * On success: 200 OK.
     * Malformed addresses or formulas and circular references are thrown as exceptions
     * which the GlobalExceptionHandler turns into a 400.
     */
    @PutMapping("/cells/{address}")
    public ResponseEntity<Void> setCellValue(@PathVariable String address, @RequestBody String rawValue) {
        logger.info("Received update for cell {}: {}", address, rawValue);
        String trimmed = rawValue.trim();
        if (LITERAL_PATTERN.matcher(trimmed).matches()) {
            sheetService.setCellValue(address, parseLiteral(trimmed));
        } else {
            sheetService.setCellValue(address, (Object) trimmed);
        }
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/cells/{address}
     * Returns the cell's address, value and formula; unset cells report value 0.
     */
    @GetMapping("/cells/{address}")
    public ResponseEntity<CellView> getCell(@PathVariable String address) {
        return ResponseEntity.ok(sheetService.getCell(address));
    }

    /**
     * GET /sheet
     * Returns a map of computed values for every stored cell,
     * in the format: { "A1": 12, "B1": 36, ... }.
     */
    @GetMapping
    public ResponseEntity<Map<String, Long>> getSheet() {
        return ResponseEntity.ok(sheetService.getSheetData());
    }

    /**
     * GET /sheet/forwardDependencies
     * Returns the forward dependency graph of the sheet,
     * i.e., for each cell => the set of cells it references.
     */
    @GetMapping("/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph() {
        return ResponseEntity.ok(sheetService.getForwardGraph());
    }

    /**
     * GET /sheet/reverseDependencies
     * Returns the reverse dependency graph of the sheet,
     * i.e., for each cell => the set of cells that reference it.
     */
    @GetMapping("/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph() {
        return ResponseEntity.ok(sheetService.getReverseGraph());
    }

    private static long parseLiteral(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new InvalidTypeException("Integer literal out of range: " + text);
        }
    }
}
