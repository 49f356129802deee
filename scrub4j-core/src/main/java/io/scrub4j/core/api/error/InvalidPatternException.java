/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api.error;

import java.util.regex.PatternSyntaxException;

public class InvalidPatternException extends ScrubberException {

    public InvalidPatternException(String pattern, PatternSyntaxException cause) {
        super("Invalid scrub pattern '" + pattern + "': " + cause.getDescription(), cause);
    }
}
