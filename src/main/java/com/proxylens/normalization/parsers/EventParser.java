package com.proxylens.normalization.parsers;

import com.proxylens.normalization.LogDialect;

import java.util.Map;

/**
 * Tokenizes one raw line of a specific dialect into a flat field map.
 * Implementations only split the line; mapping fields onto an event is shared.
 */
public interface EventParser {

    /**
     * Splits the line into named fields
     *
     * @param line the raw line, never blank
     * @return case-insensitive field map, values as they appear in the line
     * @throws ParseException if the line is not valid in this dialect
     */
    Map<String, String> tokenize(String line) throws ParseException;

    /**
     * Returns the dialect this parser handles
     */
    LogDialect getDialect();
}
