package com.cellgraph.app.services;

import com.cellgraph.app.formula.RangeFunctionType;
import com.cellgraph.app.models.CellAddress;
import com.cellgraph.app.models.CellData;
import com.cellgraph.app.models.CellValue;
import com.cellgraph.app.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes SUM/AVG/MIN/MAX/STDEV over the populated cells of a range.
 * Empty cells count for nothing: they are neither values nor part of the denominator.
 * AVG and STDEV leave text cells out the same way; SUM, MIN and MAX treat text as arithmetic
 * on a non-number and return TYPE_MISMATCH.
 * Any error inside the range makes the result BAD_REF. The first offending cell in row-major
 * order decides between the two. With no numbers at all, the result is 0.
 */
final class RangeAggregator {

    private RangeAggregator() {
    }

    static CellValue aggregate(RangeFunctionType type, Iterable<Map.Entry<CellAddress, CellData>> cells) {
        List<Double> numbers = new ArrayList<>();
        for (Map.Entry<CellAddress, CellData> entry : cells) {
            CellValue value = entry.getValue().getValue();
            switch (value.getType()) {
                case NUMBER:
                    numbers.add(value.getNumber());
                    break;
                case ERROR:
                    return CellValue.error(ErrorKind.BAD_REF);
                case TEXT:
                    if (!skipsText(type)) {
                        return CellValue.error(ErrorKind.TYPE_MISMATCH);
                    }
                    break;
                case EMPTY:
                    break;
                default:
                    throw new IllegalStateException("Unknown value type " + value.getType());
            }
        }
        if (numbers.isEmpty()) {
            return CellValue.number(0);
        }
        switch (type) {
            case SUM:
                return CellValue.number(sum(numbers));
            case AVG:
                return CellValue.number(sum(numbers) / numbers.size());
            case MIN:
                return CellValue.number(numbers.stream().mapToDouble(Double::doubleValue).min().getAsDouble());
            case MAX:
                return CellValue.number(numbers.stream().mapToDouble(Double::doubleValue).max().getAsDouble());
            case STDEV:
                return CellValue.number(populationStdev(numbers));
            default:
                throw new IllegalStateException("Unknown range function " + type);
        }
    }

    private static boolean skipsText(RangeFunctionType type) {
        switch (type) {
            case AVG:
            case STDEV:
                return true;
            case SUM:
            case MIN:
            case MAX:
                return false;
            default:
                throw new IllegalStateException("Unknown range function " + type);
        }
    }

    private static double sum(List<Double> numbers) {
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return total;
    }

    // divides by n, not n - 1
    private static double populationStdev(List<Double> numbers) {
        double mean = sum(numbers) / numbers.size();
        double squares = 0;
        for (double n : numbers) {
            squares += (n - mean) * (n - mean);
        }
        return Math.sqrt(squares / numbers.size());
    }
}
