package org.logica.modules;

/**
 * Polarità di una sottoformula rispetto alla formula che la contiene.
 */
public enum Polarity {
    POSITIVE("positive", 1),
    NEGATIVE("negative", -1),
    MIXED("mixed", 0);

    private final String label;
    private final int value;

    Polarity(String label, int value) {
        this.label = label;
        this.value = value;
    }

    public String label() {
        return label;
    }

    /** +1, -1, oppure 0 per polarità mista */
    public int value() {
        return value;
    }

    public Polarity flip() {
        return switch (this) {
            case POSITIVE -> NEGATIVE;
            case NEGATIVE -> POSITIVE;
            case MIXED -> MIXED;
        };
    }

    public static Polarity fromSign(int sign) {
        if (sign > 0) return POSITIVE;
        if (sign < 0) return NEGATIVE;
        return MIXED;
    }
}
