package com.spreadsheet.formula.engine.functions;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import static com.spreadsheet.formula.engine.functions.FunctionDefinition.VARIADIC;

/**
 * The closed set of functions formulas can call, keyed by uppercase name.
 */
public final class FunctionTable {

    private static final Map<String, FunctionDefinition> FUNCTIONS = new TreeMap<>();

    static {
        // Aggregate
        register("SUM", 0, VARIADIC, AggregateFunctions::sum);
        register("AVERAGE", 0, VARIADIC, AggregateFunctions::average);
        register("COUNT", 0, VARIADIC, AggregateFunctions::count);
        register("COUNTA", 0, VARIADIC, AggregateFunctions::countA);
        register("MIN", 0, VARIADIC, AggregateFunctions::min);
        register("MAX", 0, VARIADIC, AggregateFunctions::max);

        // Math
        register("ABS", 1, 1, MathFunctions::abs);
        register("ROUND", 1, 2, MathFunctions::round);
        register("FLOOR", 1, 2, MathFunctions::floor);
        register("CEILING", 1, 2, MathFunctions::ceiling);
        register("MOD", 2, 2, MathFunctions::mod);
        register("POWER", 2, 2, MathFunctions::power);
        register("SQRT", 1, 1, MathFunctions::sqrt);

        // Text
        register("CONCATENATE", 0, VARIADIC, TextFunctions::concatenate);
        register("UPPER", 1, 1, TextFunctions::upper);
        register("LOWER", 1, 1, TextFunctions::lower);
        register("LEN", 1, 1, TextFunctions::len);
        register("LEFT", 1, 2, TextFunctions::left);
        register("RIGHT", 1, 2, TextFunctions::right);
        register("MID", 3, 3, TextFunctions::mid);
        register("TRIM", 1, 1, TextFunctions::trim);
        register("SUBSTITUTE", 3, 4, TextFunctions::substitute);
        register("TEXT", 2, 2, TextFunctions::text);

        // Logical
        register("IF", 2, 3, LogicalFunctions::ifFunction);
        register("AND", 1, VARIADIC, LogicalFunctions::and);
        register("OR", 1, VARIADIC, LogicalFunctions::or);
        register("NOT", 1, 1, LogicalFunctions::not);
        register("IFERROR", 2, 2, LogicalFunctions::ifError);

        // Date
        register("TODAY", 0, 0, DateFunctions::today);
        register("NOW", 0, 0, DateFunctions::now);
        register("YEAR", 1, 1, DateFunctions::year);
        register("MONTH", 1, 1, DateFunctions::month);
        register("DAY", 1, 1, DateFunctions::day);

        // Lookup
        register("INDEX", 2, 3, LookupFunctions::index);
    }

    private FunctionTable() {
    }

    private static void register(String name, int minArgs, int maxArgs, BuiltinFunction body) {
        FUNCTIONS.put(name, new FunctionDefinition(name, minArgs, maxArgs, body));
    }

    /**
     * Finds a function by name, ignoring case.
     */
    public static Optional<FunctionDefinition> lookup(String name) {
        return Optional.ofNullable(FUNCTIONS.get(name.toUpperCase(Locale.ROOT)));
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(FUNCTIONS.keySet());
    }
}
