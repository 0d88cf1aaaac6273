package com.hmmtagger.server.ai;

/**
 * A hidden state of the model, e.g. a part-of-speech tag. Compared by name.
 */
public final class State {
    private final String name;

    private State(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("State name must not be blank");
        }
        this.name = name;
    }

    public static State of(String name) {
        return new State(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Pairs this state with the observation it emitted.
     */
    public LabeledObservation emitting(Observation observation) {
        return new LabeledObservation(this, observation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof State))
            return false;
        return name.equals(((State) o).name);
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
