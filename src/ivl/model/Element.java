package ivl.model;

import java.math.BigInteger;

/**
 * A concrete value in a counterexample model: a boolean, a bit-vector
 * numeral, an integer or an uninterpreted token.
 */
public abstract class Element {

    /** Returns the element denoted by a value token of the model file. */
    public static Element parse(String token) {
        if (token.equals("true") || token.equals("false")) {
            return new BooleanElement(token.equals("true"));
        }
        int bv = token.indexOf("bv");
        if (bv > 0 && isDigits(token.substring(0, bv)) && isDigits(token.substring(bv + 2))) {
            return new BitVectorElement(new BigInteger(token.substring(0, bv)),
                    Integer.parseInt(token.substring(bv + 2)));
        }
        if (isDigits(token) || (token.startsWith("-") && isDigits(token.substring(1)))) {
            return new NumberElement(new BigInteger(token));
        }
        return new UninterpretedElement(token);
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the numeric value of a bit-vector or integer element.
     * @throws IllegalStateException for other elements.
     */
    public BigInteger asNumber() {
        throw new IllegalStateException("[ERROR in Element] " + this + " is not a number");
    }

    /**
     * Returns the value of a boolean element.
     * @throws IllegalStateException for other elements.
     */
    public boolean asBoolean() {
        throw new IllegalStateException("[ERROR in Element] " + this + " is not a boolean");
    }
}
