package langfst.fst;

/**
 * A transition of the lexicon transducer. The terminating arc into the final state carries {@link #FINAL_LABEL} on
 * both sides.
 */
public record Arc(int source, int dest, int inputLabel, int outputLabel, float weight) {

    public static final int EPSILON = 0;

    public static final int FINAL_LABEL = -1;

    public static Arc of(int source, int dest, int inputLabel, int outputLabel) {
        return new Arc(source, dest, inputLabel, outputLabel, 0f);
    }

    public boolean isFinal() {
        return inputLabel == FINAL_LABEL && outputLabel == FINAL_LABEL;
    }
}
