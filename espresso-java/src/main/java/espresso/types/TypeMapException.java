package espresso.types;

import espresso.TranspileException;

public class TypeMapException extends TranspileException {

    private final String typeText;

    public TypeMapException(String message, String typeText) {
        super(message + " in type '" + typeText + "'", 0, 0);
        this.typeText = typeText;
    }

    public String typeText() { return typeText; }
}
