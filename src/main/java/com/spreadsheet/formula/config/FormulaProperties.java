package com.spreadsheet.formula.config;

import com.spreadsheet.formula.engine.FormulaEngine;
import com.spreadsheet.formula.engine.Parser;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from the "formula.*" properties:
 * - maxCellDepth: longest chain of formula cells resolved before giving up with #VALUE!
 * - maxExpressionDepth: deepest nesting of parentheses/operators the parser accepts
 * - maxRangeCells: most cells a single range may cover before it gives #REF!
 * - timeZone: zone of the clock behind TODAY() and NOW()
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {
    private int maxCellDepth = FormulaEngine.DEFAULT_MAX_CELL_DEPTH;
    private int maxExpressionDepth = Parser.DEFAULT_MAX_DEPTH;
    private long maxRangeCells = FormulaEngine.DEFAULT_MAX_RANGE_CELLS;
    private String timeZone = "UTC";

    public int getMaxCellDepth() {
        return maxCellDepth;
    }
    public int getMaxExpressionDepth() {
        return maxExpressionDepth;
    }
    public long getMaxRangeCells() {
        return maxRangeCells;
    }
    public String getTimeZone() {
        return timeZone;
    }
    public void setMaxCellDepth(int maxCellDepth) {
        this.maxCellDepth = maxCellDepth;
    }
    public void setMaxExpressionDepth(int maxExpressionDepth) {
        this.maxExpressionDepth = maxExpressionDepth;
    }
    public void setMaxRangeCells(long maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }
    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }
}
