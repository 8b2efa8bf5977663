package org.fortranonjava.core;

/**
 * Default values of the kind parameters of the intrinsic types.
 * <p>
 * Most of these can be configured through {@link org.fortranonjava.CompilerOptions};
 * the subscript integer kind is fixed at 8 because all address calculations are
 * 64-bit safe.
 */
public class IntrinsicTypeDefaultKinds {

    public enum TypeCategory {
        INTEGER, REAL, COMPLEX, CHARACTER, LOGICAL, DERIVED
    }

    private int defaultIntegerKind = 4;
    private int defaultRealKind = defaultIntegerKind;
    private int doublePrecisionKind = 2 * defaultRealKind;
    private int quadPrecisionKind = 2 * doublePrecisionKind;
    private int defaultCharacterKind = 1;
    private int defaultLogicalKind = defaultIntegerKind;

    public static int subscriptIntegerKind() {
        return 8;
    }

    public int doublePrecisionKind() {
        return doublePrecisionKind;
    }

    public int quadPrecisionKind() {
        return quadPrecisionKind;
    }

    public IntrinsicTypeDefaultKinds setDefaultIntegerKind(int kind) {
        requireKind(kind, 1, 2, 4, 8, 16);
        defaultIntegerKind = kind;
        return this;
    }

    public IntrinsicTypeDefaultKinds setDefaultRealKind(int kind) {
        requireKind(kind, 2, 3, 4, 8, 10, 16);
        defaultRealKind = kind;
        return this;
    }

    public IntrinsicTypeDefaultKinds setDoublePrecisionKind(int kind) {
        requireKind(kind, 4, 8, 10, 16);
        doublePrecisionKind = kind;
        return this;
    }

    public IntrinsicTypeDefaultKinds setQuadPrecisionKind(int kind) {
        requireKind(kind, 8, 10, 16);
        quadPrecisionKind = kind;
        return this;
    }

    public IntrinsicTypeDefaultKinds setDefaultCharacterKind(int kind) {
        requireKind(kind, 1, 2, 4);
        defaultCharacterKind = kind;
        return this;
    }

    public IntrinsicTypeDefaultKinds setDefaultLogicalKind(int kind) {
        requireKind(kind, 1, 2, 4, 8);
        defaultLogicalKind = kind;
        return this;
    }

    /**
     * Returns the default kind for an intrinsic type category.
     *
     * @param category the type category
     * @return the kind value
     */
    public int getDefaultKind(TypeCategory category) {
        return switch (category) {
            case INTEGER -> defaultIntegerKind;
            case REAL, COMPLEX -> defaultRealKind;
            case CHARACTER -> defaultCharacterKind;
            case LOGICAL -> defaultLogicalKind;
            case DERIVED -> throw InternalCompilerError.die("no default kind for derived types");
        };
    }

    private static void requireKind(int kind, int... allowed) {
        for (int a : allowed) {
            if (a == kind) {
                return;
            }
        }
        throw new FortranCompilerException("Unsupported kind value " + kind);
    }

    @Override
    public String toString() {
        return "IntrinsicTypeDefaultKinds{" +
                "integer=" + defaultIntegerKind +
                ", real=" + defaultRealKind +
                ", double=" + doublePrecisionKind +
                ", quad=" + quadPrecisionKind +
                ", character=" + defaultCharacterKind +
                ", logical=" + defaultLogicalKind +
                '}';
    }
}
