package com.skylarkarms.cell;

/**
 * Ends the life of the instance held by a {@link PublishedCell}.
 * <p> Will be called at most once per cell, by the one caller that wins the teardown.
 * */
@FunctionalInterface
public interface Destructor<T> {
    void destruct(T t) throws Exception;

    /**
     * Closes {@link AutoCloseable} instances, does nothing for any other type.
     * */
    @SuppressWarnings("unchecked")
    static <T> Destructor<T> defaultDestruct() { return (Destructor<T>) DEFAULT.ref; }

    /**
     * Leaves the instance untouched.
     * */
    @SuppressWarnings("unchecked")
    static <T> Destructor<T> noDestruct() { return (Destructor<T>) NONE.ref; }

    record DEFAULT() {
        static final Destructor<Object> ref = new Destructor<>() {
            @Override
            public void destruct(Object o) throws Exception {
                if (o instanceof AutoCloseable closeable) closeable.close();
            }

            @Override
            public String toString() { return "Destructor[default]"; }
        };
    }

    record NONE() {
        static final Destructor<Object> ref = new Destructor<>() {
            @Override
            public void destruct(Object o) {}

            @Override
            public String toString() { return "Destructor[none]"; }
        };
    }
}
