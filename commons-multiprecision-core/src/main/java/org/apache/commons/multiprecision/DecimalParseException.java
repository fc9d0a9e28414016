/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.commons.multiprecision;

/**
 * Thrown when a string cannot be parsed as a decimal number.
 */
public class DecimalParseException extends NumberFormatException {
    /** Serializable version identifier. */
    private static final long serialVersionUID = 20261017L;

    /** The reason the input could not be parsed. */
    public enum Kind {
        /** The input was empty or only whitespace. */
        EMPTY,
        /** The input contained an invalid character or was badly formed. */
        INVALID
    }

    /** The kind of error. */
    private final Kind kind;

    /**
     * Create an instance.
     *
     * @param kind Kind of error.
     * @param message Message.
     */
    DecimalParseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Create an exception for empty input.
     *
     * @return the exception
     */
    static DecimalParseException empty() {
        return new DecimalParseException(Kind.EMPTY, "Empty input");
    }

    /**
     * Create an exception for invalid input.
     *
     * @param input Input.
     * @param index Index of the offending character.
     * @return the exception
     */
    static DecimalParseException invalid(String input, int index) {
        return new DecimalParseException(Kind.INVALID,
            String.format("Invalid decimal '%s' at index %d", input, index));
    }

    /**
     * Gets the kind of error.
     *
     * @return the kind
     */
    public Kind getKind() {
        return kind;
    }
}
