/* @LICENSE@
 */
package org.rxdfa.regex;

import org.rxdfa.regex.RegexDfa.ConversionException;

/**
 * The outcome of {@link RegexDfa#convert(String)}: either an
 * {@link Automaton} or the {@link ConversionError} which prevented it. Callers
 * check {@link #isSuccess()} before reading either side.
 */
public final class ConversionResult {

    private final Automaton automaton;
    private final ConversionError error;

    private ConversionResult(Automaton automaton, ConversionError error) {
        assert (automaton == null) != (error == null);
        this.automaton = automaton;
        this.error = error;
    }

    static ConversionResult success(Automaton automaton) {
        if (automaton == null) throw new NullPointerException("automaton");
        return new ConversionResult(automaton, null);
    }

    static ConversionResult failure(ConversionError error) {
        if (error == null) throw new NullPointerException("error");
        return new ConversionResult(null, error);
    }

    public boolean isSuccess() {
        return automaton != null;
    }

    public boolean isFailure() {
        return !isSuccess();
    }

    /**
     * @throws IllegalStateException if the conversion failed.
     */
    public Automaton automaton() {
        if (automaton == null) {
            throw new IllegalStateException("conversion failed: " + error);
        }
        return automaton;
    }

    /**
     * @throws IllegalStateException if the conversion succeeded.
     */
    public ConversionError error() {
        if (error == null) {
            throw new IllegalStateException("conversion succeeded");
        }
        return error;
    }

    /**
     * @return the automaton
     * @throws ConversionException carrying the error if the conversion failed.
     */
    public Automaton orThrow() {
        if (error != null) {
            throw new ConversionException(error);
        }
        return automaton;
    }

    @Override
    public String toString() {
        return isSuccess() ? "success: " + automaton.size() + " states"
                           : "failure: " + error;
    }
}
