package net.schedra.core.spi;

public class FunctionNotFoundException extends Exception {
    private final String function;

    public FunctionNotFoundException(String function) {
        super("'" + function + "' is not available.");
        this.function = function;
    }

    public String function() { return function; }
}
