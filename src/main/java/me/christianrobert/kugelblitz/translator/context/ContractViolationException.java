package me.christianrobert.kugelblitz.translator.context;

/**
 * Input breaks a grammar restriction the translator relies on,
 * such as a chained comparison.
 */
public class ContractViolationException extends TranslationException {

    public ContractViolationException(String message) {
        super(message);
    }
}
