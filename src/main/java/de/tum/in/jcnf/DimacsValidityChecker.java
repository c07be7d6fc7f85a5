/*
 * This file is part of JCNF.
 * Copyright (c) 2025 The JCNF authors.
 *
 * JCNF is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JCNF is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JCNF. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jcnf;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Counts tautological clauses of formulas in DIMACS CNF format, working directly on the integer
 * literals. A clause is tautological if it contains some literal {@code x} together with
 * {@code -x}.
 */
public final class DimacsValidityChecker {
    private static final Logger logger = Logger.getLogger(DimacsValidityChecker.class.getName());
    private static final Pattern WHITESPACE = Pattern.compile("[ \t]+");
    private static final String UNNAMED_SOURCE = "<input>";

    private DimacsValidityChecker() {}

    public static ValidityReport check(Path path) throws IOException, InvalidFormatException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return check(reader, path.toString());
        }
    }

    public static ValidityReport check(BufferedReader reader) throws IOException, InvalidFormatException {
        return check(reader, UNNAMED_SOURCE);
    }

    private static ValidityReport check(BufferedReader reader, String source)
            throws IOException, InvalidFormatException {
        int lineNumber = 0;
        String header;
        while (true) {
            header = reader.readLine();
            if (header == null) {
                throw new InvalidFormatException(source, lineNumber, "No problem line found");
            }
            lineNumber += 1;
            if (!header.isEmpty() && header.charAt(0) == 'p') {
                break;
            }
        }

        String[] array = WHITESPACE.split(header.strip());
        if (array.length != 4 || !"p".equals(array[0]) || !"cnf".equals(array[1])) {
            throw new InvalidFormatException(source, lineNumber, "Invalid problem line " + header);
        }
        int variables;
        int clauses;
        try {
            variables = Integer.parseInt(array[2]);
            clauses = Integer.parseInt(array[3]);
        } catch (NumberFormatException e) {
            throw new InvalidFormatException(source, lineNumber, "Invalid problem line " + header, e);
        }
        if (variables < 0 || clauses < 0) {
            throw new InvalidFormatException(source, lineNumber, "Invalid problem line " + header);
        }
        logger.log(Level.FINE, "Checking {0}: {1} variables, {2} clauses", new Object[] {source, variables, clauses});

        int tautological = 0;
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < clauses; i++) {
            String clauseLine = reader.readLine();
            if (clauseLine == null) {
                throw new InvalidFormatException(source, lineNumber,
                        String.format("Expected %d clauses, found only %d", clauses, i));
            }
            lineNumber += 1;
            seen.clear();
            if (isTautological(clauseLine, seen, source, lineNumber)) {
                tautological += 1;
            }
        }
        return ValidityReport.of(clauses, tautological);
    }

    // Scans the literals of the line up to the terminating 0 or the first literal whose negation was
    // already seen; the remainder of the line is not inspected in the latter case.
    private static boolean isTautological(String clauseLine, Set<Long> seen, String source, int lineNumber)
            throws InvalidFormatException {
        String stripped = clauseLine.strip();
        if (stripped.isEmpty()) {
            throw new InvalidFormatException(source, lineNumber, "Empty clause line");
        }
        String[] clause = WHITESPACE.split(stripped);
        for (int j = 0; j < clause.length; j++) {
            long literal;
            try {
                literal = Integer.parseInt(clause[j]);
            } catch (NumberFormatException e) {
                throw new InvalidFormatException(source, lineNumber, "Invalid clause " + clauseLine, e);
            }
            if (literal == 0) {
                if (j != clause.length - 1) {
                    throw new InvalidFormatException(source, lineNumber, "Literals after terminating 0: " + clauseLine);
                }
                return false;
            }
            if (seen.contains(-literal)) {
                return true;
            }
            seen.add(literal);
        }
        throw new InvalidFormatException(source, lineNumber, "Clause not terminated by 0: " + clauseLine);
    }

    public static class InvalidFormatException extends Exception {
        private static final long serialVersionUID = 1L;

        private final String source;
        private final int lineNumber;

        public InvalidFormatException(String source, int lineNumber, String message) {
            this(source, lineNumber, message, null);
        }

        public InvalidFormatException(String source, int lineNumber, String message, @Nullable Throwable cause) {
            super(String.format("%s:%d: %s", source, lineNumber, message), cause);
            this.source = source;
            this.lineNumber = lineNumber;
        }

        public String source() {
            return source;
        }

        /** One-based number of the offending line, {@code 0} if the input was empty. */
        public int lineNumber() {
            return lineNumber;
        }
    }
}
