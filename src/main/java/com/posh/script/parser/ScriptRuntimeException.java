package com.posh.script.parser;

/**
 * Error raised while evaluating a script. Carries a {@link Kind} plus the names and
 * value kinds involved, so hosts can build their own messages.
 */
public class ScriptRuntimeException extends RuntimeException {

    public enum Kind {
        UNDEFINED_VARIABLE,
        TYPE_MISMATCH,
        DIVISION_BY_ZERO,
        COMMAND_NOT_FOUND,
        INVALID_PROPERTY_ACCESS,
        RETURN_OUTSIDE_FUNCTION,
        INVALID_OPERATION,
        CALL_DEPTH_EXCEEDED
    }

    /** Why a member access failed; both causes share {@link Kind#INVALID_PROPERTY_ACCESS}. */
    public enum PropertyFailure { NOT_A_RECORD, MISSING_PROPERTY }

    private final Kind kind;
    private final String name;
    private final String operation;
    private final String expected;
    private final String actual;
    private final PropertyFailure propertyFailure;

    private ScriptRuntimeException(Kind kind, String message, String name, String operation,
                                   String expected, String actual, PropertyFailure propertyFailure,
                                   Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.name = name;
        this.operation = operation;
        this.expected = expected;
        this.actual = actual;
        this.propertyFailure = propertyFailure;
    }

    public static ScriptRuntimeException undefinedVariable(String name) {
        return new ScriptRuntimeException(Kind.UNDEFINED_VARIABLE,
                "Undefined variable: $" + name, name, null, null, null, null, null);
    }

    public static ScriptRuntimeException typeMismatch(String operation, String expected, String actual) {
        return new ScriptRuntimeException(Kind.TYPE_MISMATCH,
                "Type mismatch in " + operation + ": expected " + expected + ", got " + actual,
                null, operation, expected, actual, null, null);
    }

    public static ScriptRuntimeException divisionByZero(String operation) {
        return new ScriptRuntimeException(Kind.DIVISION_BY_ZERO,
                "Attempted to divide by zero", null, operation, null, null, null, null);
    }

    public static ScriptRuntimeException commandNotFound(String name) {
        return new ScriptRuntimeException(Kind.COMMAND_NOT_FOUND,
                "The term '" + name + "' is not recognized as a function or command",
                name, null, null, null, null, null);
    }

    public static ScriptRuntimeException notARecord(String member, Value.Type actual) {
        return new ScriptRuntimeException(Kind.INVALID_PROPERTY_ACCESS,
                "Cannot access property '" + member + "' on a value of type " + actual,
                member, "member access", "RECORD", actual.name(), PropertyFailure.NOT_A_RECORD, null);
    }

    public static ScriptRuntimeException missingProperty(String member) {
        return new ScriptRuntimeException(Kind.INVALID_PROPERTY_ACCESS,
                "Property '" + member + "' does not exist",
                member, "member access", null, null, PropertyFailure.MISSING_PROPERTY, null);
    }

    public static ScriptRuntimeException returnOutsideFunction() {
        return new ScriptRuntimeException(Kind.RETURN_OUTSIDE_FUNCTION,
                "'return' used outside of a function", null, null, null, null, null, null);
    }

    public static ScriptRuntimeException invalidOperation(String message) {
        return new ScriptRuntimeException(Kind.INVALID_OPERATION, message, null, null, null, null, null, null);
    }

    public static ScriptRuntimeException invalidOperation(String message, Throwable cause) {
        return new ScriptRuntimeException(Kind.INVALID_OPERATION, message, null, null, null, null, null, cause);
    }

    public static ScriptRuntimeException callDepthExceeded(String function, int limit) {
        return new ScriptRuntimeException(Kind.CALL_DEPTH_EXCEEDED,
                "Max call depth exceeded (" + limit + ") calling " + function,
                function, null, null, null, null, null);
    }

    public Kind getKind() { return kind; }

    /** Variable, command, function or member name involved, if any. */
    public String getName() { return name; }

    public String getOperation() { return operation; }

    public String getExpected() { return expected; }

    public String getActual() { return actual; }

    /** Only set for {@link Kind#INVALID_PROPERTY_ACCESS}. */
    public PropertyFailure getPropertyFailure() { return propertyFailure; }
}
