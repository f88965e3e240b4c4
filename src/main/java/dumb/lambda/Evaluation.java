package dumb.lambda;

import static java.util.Objects.requireNonNull;

/** Outcome of iterated reduction. */
public sealed interface Evaluation permits Evaluation.NormalForm, Evaluation.LimitExceeded {

    /** Last term reached; the normal form, or where the step limit stopped. */
    Term term();

    int steps();

    default boolean normal() {
        return this instanceof NormalForm;
    }

    record NormalForm(Term term, int steps) implements Evaluation {
        public NormalForm {
            requireNonNull(term);
        }
    }

    /** The step limit was reached while a redex remained. */
    record LimitExceeded(Term term, int limit) implements Evaluation {
        public LimitExceeded {
            requireNonNull(term);
        }

        @Override
        public int steps() {
            return limit;
        }
    }
}
