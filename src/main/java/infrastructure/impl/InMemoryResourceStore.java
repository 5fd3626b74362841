package infrastructure.impl;

import domain.interfaces.IResourceStore;
import domain.model.Resource;

import java.util.function.Consumer;
import java.util.concurrent.locks.ReentrantLock;

public class InMemoryResourceStore implements IResourceStore {

    // fair: PUT, GET, PUT -> the GET sees the first PUT only
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Resource resource;

    public InMemoryResourceStore() {
        this(Resource.defaults());
    }

    public InMemoryResourceStore(Resource initial) {
        this.resource = initial.copy();
    }

    @Override
    public Resource get() {
        lock.lock();
        try {
            return resource.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Resource update(Consumer<Resource> mutation) {
        lock.lock();
        try {
            mutation.accept(resource);
            return resource.copy();
        } finally {
            lock.unlock();
        }
    }
}
