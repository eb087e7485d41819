package com.agenttracker.discovery.service.classify;

/**
 * How a classification answer was read.
 */
public enum ParseOutcome {
    /** Answer was a JSON object as asked */
    STRICT,
    /** JSON found inside a code fence or surrounding prose */
    FENCED,
    /** Fields recovered one by one from broken JSON */
    SALVAGED,
    /** Nothing usable, or the call failed */
    DEFAULTED
}
