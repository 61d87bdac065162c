package org.dissync.controller;

/**
 * A view in the host tool that shows sync information and is reloaded periodically.
 */
public interface InfoSurface {

    /**
     * @throws SurfaceClosedException if the view is gone; the sync loop stops reloading it.
     */
    void reload() throws SurfaceClosedException;
}
