package org.dissync.client;

import org.dissync.state.State;

import java.io.IOException;

/**
 * Work done on the writable master state inside {@link Client#stateCtx}.
 *
 * @param <T> The result type.
 */
@FunctionalInterface
public interface StateAction<T> {
    T apply(State state) throws IOException;
}
