package com.cinder;

/**
 * Cancellation signal shared by the stages of one compilation run.
 *
 * <p>The lexer polls {@link #hasErrors()} between tokens and stops producing output once it
 * returns {@code true}.</p>
 */
@FunctionalInterface
public interface Supervisor {

    /**
     * @return true once any error has been recorded for this run
     */
    boolean hasErrors();
}
