package domain.interfaces;

import domain.model.Resource;

import java.util.function.Consumer;

public interface IResourceStore {
    /** Copy of the current record. */
    Resource get();

    /** Runs {@code mutation} on the stored record while holding the store's lock, returns a copy of the result. */
    Resource update(Consumer<Resource> mutation);
}
