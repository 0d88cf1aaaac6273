package com.hmmtagger.server.ai;

/**
 * An observed symbol, e.g. a word token. Compared by name.
 */
public final class Observation {
    private final String name;

    private Observation(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Observation name must not be blank");
        }
        this.name = name;
    }

    public static Observation of(String name) {
        return new Observation(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Labels this observation with the state that emitted it.
     */
    public LabeledObservation as(State state) {
        return new LabeledObservation(state, this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Observation))
            return false;
        return name.equals(((Observation) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
