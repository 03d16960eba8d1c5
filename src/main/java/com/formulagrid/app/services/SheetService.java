package com.formulagrid.app.services;

import com.formulagrid.app.exceptions.CircularReferenceException;
import com.formulagrid.app.exceptions.ExpressionParseException;
import com.formulagrid.app.exceptions.InvalidTypeException;
import com.formulagrid.app.formula.Evaluator;
import com.formulagrid.app.formula.Expression;
import com.formulagrid.app.formula.FormulaParser;
import com.formulagrid.app.formula.ReferenceCollector;
import com.formulagrid.app.graph.DependencyGraph;
import com.formulagrid.app.models.Cell;
import com.formulagrid.app.models.CellAddress;
import com.formulagrid.app.models.CellId;
import com.formulagrid.app.models.CellView;
import com.formulagrid.app.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Main business logic for setting cell values, keeping the dependency graph
 * up to date, detecting cycles and re-evaluating affected cells.
 */
@Service
public class SheetService {

    private static final Logger logger = LoggerFactory.getLogger(SheetService.class);

    // The single sheet lives here in memory; no persistence
    private final Sheet sheet = new Sheet();
    private final FormulaParser parser;

    public SheetService() {
        this(FormulaParser.DEFAULT_MAX_NESTING_DEPTH);
    }

    @Autowired
    public SheetService(@Value("${formula.parser.max-nesting-depth:" + FormulaParser.DEFAULT_MAX_NESTING_DEPTH + "}")
                        int maxNestingDepth) {
        this.parser = new FormulaParser(maxNestingDepth);
    }

    /**
     * Sets a cell to either a literal integer ({@link Integer} or {@link Long})
     * or formula text such as "=A1+B2*3".
     * Throws InvalidTypeException for any other kind of value.
     */
    public void setCellValue(String address, Object value) {
        CellId id = CellAddress.parse(address);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            applyLiteral(id, ((Number) value).longValue());
        } else if (value instanceof String) {
            applyFormula(id, (String) value);
        } else {
            String type = value == null ? "null" : value.getClass().getSimpleName();
            throw new InvalidTypeException("Cell " + id + " accepts an integer or formula text, got " + type);
        }
    }

    /**
     * Sets a cell to a literal integer, clearing any formula it held.
     */
    public void setCellValue(String address, long value) {
        applyLiteral(CellAddress.parse(address), value);
    }

    /**
     * Returns the value computed by the last successful mutation,
     * or 0 for a cell that was never set. Never triggers re-evaluation.
     */
    public long getCellValue(String address) {
        CellId id = CellAddress.parse(address);
        sheet.getLock().readLock().lock();
        try {
            return sheet.valueOf(id);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Returns the address, value and formula (if any) of a cell.
     * Unset cells are reported with value 0 and no formula.
     */
    public CellView getCell(String address) {
        CellId id = CellAddress.parse(address);
        sheet.getLock().readLock().lock();
        try {
            Cell cell = sheet.getCell(id);
            if (cell == null) {
                return new CellView(id.toString(), 0, null);
            }
            return new CellView(id.toString(), cell.getValue(), cell.getFormula());
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Returns a map of address -> value for all stored cells, ordered by row then column.
     * No evaluation here, because each cell's value is stored at set time.
     */
    public Map<String, Long> getSheetData() {
        sheet.getLock().readLock().lock();
        try {
            Map<CellId, Long> sorted = new TreeMap<>();
            for (Cell cell : sheet.getCells().values()) {
                sorted.put(cell.getId(), cell.getValue());
            }
            Map<String, Long> data = new LinkedHashMap<>();
            sorted.forEach((id, value) -> data.put(id.toString(), value));
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * For each cell => the set of cells its formula references.
     */
    public Map<String, Set<String>> getForwardGraph() {
        sheet.getLock().readLock().lock();
        try {
            return sheet.getGraph().forwardSnapshot();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * For each cell => the set of cells whose formulas reference it.
     */
    public Map<String, Set<String>> getReverseGraph() {
        sheet.getLock().readLock().lock();
        try {
            return sheet.getGraph().reverseSnapshot();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private void applyLiteral(CellId id, long literal) {
        logger.debug("Setting {} to literal {}", id, literal);
        commit(id, cell -> cell.setLiteral(literal), Collections.emptySet());
    }

    private void applyFormula(CellId id, String formula) {
        // Parse outside the lock; a failure leaves the sheet untouched
        Expression expression = parse(id, formula);
        logger.debug("Setting {} to formula {}", id, formula);
        commit(id, cell -> cell.setFormula(formula, expression), ReferenceCollector.collect(expression));
    }

    private Expression parse(CellId id, String formula) {
        try {
            return parser.parse(formula);
        } catch (ExpressionParseException ex) {
            logger.warn("Rejected formula for {}: {}", id, ex.getMessage());
            throw ex;
        }
    }

    /**
     * Installs the changed cell and its references, then refreshes everything affected.
     * The change is applied to a copy, so if the refresh finds a cycle the previous
     * cell and references are restored untouched.
     */
    private void commit(CellId id, Consumer<Cell> change, Set<CellId> references) {
        DependencyGraph graph = sheet.getGraph();

        // Prevent race conditions among multiple writers
        sheet.getLock().writeLock().lock();
        try {
            // Keep the old cell and its references for revert if needed
            Cell oldCell = sheet.getCell(id);
            Cell newCell = oldCell == null ? new Cell(id) : new Cell(oldCell);
            change.accept(newCell);
            sheet.getCells().put(id, newCell);
            Set<CellId> oldReferences = graph.replaceOutgoingEdges(id, references);

            try {
                refresh(id);
            } catch (CircularReferenceException ex) {
                graph.replaceOutgoingEdges(id, oldReferences);
                if (oldCell == null) {
                    sheet.getCells().remove(id);
                } else {
                    sheet.getCells().put(id, oldCell);
                }
                logger.warn("Rejected update of {}: circular reference at {}", id, ex.getCycleCell());
                throw new CircularReferenceException(ex.getCycleCell(), id);
            }
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Re-evaluates every cell affected by a change to {@code changed}, in dependency order.
     * The sort runs to completion before any value is written, so a cycle leaves values untouched.
     */
    private void refresh(CellId changed) {
        DependencyGraph graph = sheet.getGraph();
        List<CellId> roots = graph.rootsAbove(changed);
        List<CellId> order = graph.topologicalOrderFrom(roots);

        for (CellId id : order) {
            Cell cell = sheet.getCell(id);
            if (cell != null && cell.hasFormula()) {
                cell.setValue(Evaluator.evaluate(cell.getExpression(), sheet::valueOf));
            }
        }
        logger.debug("Refreshed {} cell(s) after change to {}", order.size(), changed);
    }
}
