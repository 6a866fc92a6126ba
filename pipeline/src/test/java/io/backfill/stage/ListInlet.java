package io.backfill.stage;

import io.backfill.channel.Inlet;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

final class ListInlet<T> implements Inlet<T> {
    private final Iterator<T> it;

    ListInlet(List<T> items) { this.it = items.iterator(); }

    @Override
    public Optional<T> receive() {
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }
}
