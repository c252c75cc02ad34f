package me.christianrobert.kugelblitz.translator.context;

/**
 * Switches that turn documented translation limitations into hard errors.
 *
 * <p>With all switches off the translator keeps the lenient behavior:
 * tuple literals become a placeholder, floor division emits plain division and
 * class members other than functions and simple assignments are left out.</p>
 */
public class TranslationOptions {

    private static final TranslationOptions DEFAULTS = new TranslationOptions(false, false, false);

    private final boolean strictTuples;
    private final boolean strictFloorDivision;
    private final boolean strictClassMembers;

    public TranslationOptions(boolean strictTuples, boolean strictFloorDivision, boolean strictClassMembers) {
        this.strictTuples = strictTuples;
        this.strictFloorDivision = strictFloorDivision;
        this.strictClassMembers = strictClassMembers;
    }

    public static TranslationOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reject tuple literals used as expression values.
     */
    public boolean isStrictTuples() {
        return strictTuples;
    }

    /**
     * Reject floor division, which has no exact operator in the output language.
     */
    public boolean isStrictFloorDivision() {
        return strictFloorDivision;
    }

    /**
     * Reject class members that would otherwise be left out (nested classes, bare expressions).
     */
    public boolean isStrictClassMembers() {
        return strictClassMembers;
    }

    @Override
    public String toString() {
        return "TranslationOptions{strictTuples=" + strictTuples
            + ", strictFloorDivision=" + strictFloorDivision
            + ", strictClassMembers=" + strictClassMembers + "}";
    }
}
